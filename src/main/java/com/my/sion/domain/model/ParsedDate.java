package com.my.sion.domain.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * 왜: 해석 실패 시 기본값(오늘)을 쓰더라도 호출자가 "정말 오늘"과 "해석 불가"를 구분할 수 있게 하기 위함.
 */
public record ParsedDate(LocalDate date, boolean defaulted) {
    public ParsedDate {
        Objects.requireNonNull(date, "date");
    }

    public static ParsedDate parsed(LocalDate date) {
        return new ParsedDate(date, false);
    }

    public static ParsedDate fallback(LocalDate date) {
        return new ParsedDate(date, true);
    }
}
