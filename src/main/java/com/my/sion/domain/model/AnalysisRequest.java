package com.my.sion.domain.model;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * 왜: 외부에서 들어온 분석 요청의 최소 계약(식별자, 기준 시각, 원문)을 강제하기 위함.
 * 기준 시각이 없으면 처리 시점의 시계를 쓴다. command가 있으면 캘린더 계획은 텍스트 대신 명령에서 만든다.
 */
public record AnalysisRequest(String requestId, OffsetDateTime timestamp, String text, CalendarCommand command) {
    public AnalysisRequest {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(text, "text");
    }

    public AnalysisRequest(String requestId, OffsetDateTime timestamp, String text) {
        this(requestId, timestamp, text, null);
    }
}
