package com.my.sion.adapter.in.rabbitmq;

import io.quarkus.arc.profile.IfBuildProfile;
import io.smallrye.reactive.messaging.annotations.Blocking;
import io.smallrye.reactive.messaging.rabbitmq.IncomingRabbitMQMetadata;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.reactive.messaging.Incoming;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.jboss.logging.Logger;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * 왜: 처리되지 못한 분석 요청의 적체를 운영 환경에서 로그로 드러내기 위함.
 */
@IfBuildProfile("prod")
@ApplicationScoped
public class DeadLetterConsumer {

    private static final Logger log = Logger.getLogger(DeadLetterConsumer.class);

    @Incoming("nlu-requests-dlq")
    @Blocking
    public CompletionStage<Void> consume(Message<String> message) {
        Map<String, Object> headers = message.getMetadata(IncomingRabbitMQMetadata.class)
                .map(IncomingRabbitMQMetadata::getHeaders)
                .orElse(Map.of());
        log.warnf("DLQ 소비: reason=%s, queue=%s, payload=%s",
                header(headers, "x-first-death-reason"),
                header(headers, "x-first-death-queue"),
                message.getPayload());
        return message.ack();
    }

    static String header(Map<String, Object> headers, String name) {
        return Optional.ofNullable(headers.get(name)).map(String::valueOf).orElse("unknown");
    }
}
