package com.my.sion.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * 왜: 반복 주기 키워드(영문/한국어)를 RRULE FREQ 값으로 정규화하기 위함.
 */
public enum RecurrenceFrequency {
    YEARLY,
    MONTHLY,
    WEEKLY,
    DAILY;

    public static Optional<RecurrenceFrequency> fromKeyword(String keyword) {
        if (keyword == null || keyword.isBlank()) {
            return Optional.empty();
        }
        return switch (keyword.trim().toLowerCase(Locale.ROOT)) {
            case "yearly", "annually", "매년" -> Optional.of(YEARLY);
            case "monthly", "매월", "매달" -> Optional.of(MONTHLY);
            case "weekly", "매주" -> Optional.of(WEEKLY);
            case "daily", "매일" -> Optional.of(DAILY);
            default -> Optional.empty();
        };
    }
}
