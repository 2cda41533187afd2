package com.my.sion.domain.model;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * 왜: 제공자 목록 조회에 쓰는 [timeMin, timeMax) 창을 양 끝이 모두 있는 값으로 고정하기 위함.
 */
public record TimeRange(OffsetDateTime start, OffsetDateTime end) {
    public TimeRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("조회 창의 끝은 시작보다 뒤여야 합니다: " + start + " ~ " + end);
        }
    }
}
