package com.my.sion.adapter.in.rabbitmq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.sion.config.AppConfig;
import com.my.sion.domain.exception.InvalidRequestException;
import com.my.sion.domain.model.AnalysisReply;
import com.my.sion.domain.model.AnalysisRequest;
import com.my.sion.domain.port.in.ProcessAnalysisRequestUseCase;
import io.smallrye.mutiny.Uni;
import io.smallrye.reactive.messaging.annotations.Blocking;
import io.smallrye.reactive.messaging.rabbitmq.IncomingRabbitMQMetadata;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Incoming;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.io.IOException;
import java.time.ZoneId;
import java.util.Optional;

/**
 * 왜: RabbitMQ 소비자를 통해 분석 유스케이스로 진입시키는 단일 경로를 제공하기 위함.
 */
@ApplicationScoped
public class RabbitAnalysisConsumer {

    private static final Logger log = Logger.getLogger(RabbitAnalysisConsumer.class);

    private final ProcessAnalysisRequestUseCase processAnalysisRequestUseCase;
    private final ObjectMapper objectMapper;
    private final ZoneId zoneId;

    @Inject
    public RabbitAnalysisConsumer(ProcessAnalysisRequestUseCase processAnalysisRequestUseCase,
                                  ObjectMapper objectMapper,
                                  AppConfig appConfig) {
        this(processAnalysisRequestUseCase, objectMapper, ZoneId.of(appConfig.nlu().zoneId()));
    }

    RabbitAnalysisConsumer(ProcessAnalysisRequestUseCase processAnalysisRequestUseCase,
                           ObjectMapper objectMapper,
                           ZoneId zoneId) {
        this.processAnalysisRequestUseCase = processAnalysisRequestUseCase;
        this.objectMapper = objectMapper;
        this.zoneId = zoneId;
    }

    @Incoming("nlu-requests")
    @Blocking
    public Uni<Void> consume(Message<String> message) {
        return Uni.createFrom().item(() -> {
                    handle(message.getPayload(), resolveCorrelationId(message));
                    return null;
                })
                .onItem().transformToUni(ignored -> Uni.createFrom().completionStage(message::ack))
                .onFailure().recoverWithUni(failure -> {
                    log.errorf(failure, "분석 처리 실패로 메시지 거절");
                    return Uni.createFrom().completionStage(() -> message.nack(failure));
                })
                .replaceWithVoid();
    }

    void handle(String payload, Optional<String> correlationId) {
        AnalysisRequest request;
        try {
            request = objectMapper.readValue(payload, AnalysisRequestMessage.class).toAnalysisRequest(zoneId);
        } catch (IOException | InvalidRequestException e) {
            log.warnf("요청 파싱 실패로 처리 중단: %s", e.getMessage());
            return;
        }
        MDC.put("correlationId", correlationId.orElse(request.requestId()));
        MDC.put("requestId", request.requestId());
        try {
            AnalysisReply reply = processAnalysisRequestUseCase.process(request);
            log.infof("분석 완료: intent=%s, confidence=%.2f, entities=%d",
                    reply.result().intent().intent().wireName(),
                    reply.result().intent().confidence(),
                    reply.result().entities().size());
        } catch (InvalidRequestException e) {
            log.warnf("요청 검증 실패로 처리 중단: %s", e.getMessage());
        } finally {
            MDC.remove("correlationId");
            MDC.remove("requestId");
        }
    }

    private Optional<String> resolveCorrelationId(Message<String> message) {
        return message.getMetadata(IncomingRabbitMQMetadata.class)
                .flatMap(IncomingRabbitMQMetadata::getCorrelationId);
    }
}
