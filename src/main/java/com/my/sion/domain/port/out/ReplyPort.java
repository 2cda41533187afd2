package com.my.sion.domain.port.out;

import com.my.sion.domain.model.AnalysisReply;

/**
 * 왜: 응답 채널(RabbitMQ 등) 세부 구현을 숨기고 도메인이 단일 계약으로 결과를 내보내도록 하기 위함.
 */
public interface ReplyPort {
    void send(AnalysisReply reply);
}
