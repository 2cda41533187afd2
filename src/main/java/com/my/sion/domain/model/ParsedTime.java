package com.my.sion.domain.model;

import java.time.LocalTime;

/**
 * 왜: 시각 해석 결과와 기본값 사용 여부를 함께 전달하기 위함.
 */
public record ParsedTime(int hour, int minute, boolean defaulted) {
    public static final ParsedTime DEFAULT = new ParsedTime(9, 0, true);

    public ParsedTime {
        if (hour < 0 || hour > 23 || minute < 0 || minute > 59) {
            throw new IllegalArgumentException("시각 범위를 벗어났습니다: " + hour + ":" + minute);
        }
    }

    public LocalTime toLocalTime() {
        return LocalTime.of(hour, minute);
    }
}
