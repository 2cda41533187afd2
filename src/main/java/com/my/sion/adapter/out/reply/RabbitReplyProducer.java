package com.my.sion.adapter.out.reply;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.sion.config.AppConfig;
import com.my.sion.domain.model.AnalysisReply;
import com.my.sion.domain.port.out.ReplyPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Channel;
import org.eclipse.microprofile.reactive.messaging.Emitter;
import org.jboss.logging.Logger;

import java.time.ZoneId;

/**
 * 왜: 분석 결과를 RabbitMQ로 전달하는 기술적 구현을 분리하여 포트 계약을 지키기 위함.
 */
@ApplicationScoped
public class RabbitReplyProducer implements ReplyPort {

    private static final Logger log = Logger.getLogger(RabbitReplyProducer.class);

    private final Emitter<String> resultEmitter;
    private final ObjectMapper objectMapper;
    private final ZoneId zoneId;

    @Inject
    public RabbitReplyProducer(@Channel("nlu-results") Emitter<String> resultEmitter,
                               ObjectMapper objectMapper,
                               AppConfig appConfig) {
        this(resultEmitter, objectMapper, ZoneId.of(appConfig.nlu().zoneId()));
    }

    RabbitReplyProducer(Emitter<String> resultEmitter, ObjectMapper objectMapper, ZoneId zoneId) {
        this.resultEmitter = resultEmitter;
        this.objectMapper = objectMapper;
        this.zoneId = zoneId;
    }

    @Override
    public void send(AnalysisReply reply) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(AnalysisReplyMessage.from(reply, zoneId));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("분석 결과 직렬화 실패: " + reply.requestId(), e);
        }
        resultEmitter.send(payload);
        log.debugf("분석 결과 전송: requestId=%s", reply.requestId());
    }
}
