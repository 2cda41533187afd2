package com.my.sion.domain.port.in;

import com.my.sion.domain.model.AnalysisReply;
import com.my.sion.domain.model.AnalysisRequest;

/**
 * 왜: 메시지로 들어온 분석 요청을 분석, 일정 계획, 응답 전송까지 하나의 유스케이스로 처리하기 위함.
 */
public interface ProcessAnalysisRequestUseCase {
    AnalysisReply process(AnalysisRequest request);
}
