package com.my.sion.domain.model;

import java.util.Objects;

/**
 * 왜: 분석 결과와 (일정 의도일 때) 캘린더 계획을 요청 식별자와 묶어 응답 채널로 보내기 위함.
 */
public record AnalysisReply(String requestId, AnalysisResult result, CalendarPlan plan) {
    public AnalysisReply {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(result, "result");
    }
}
