package com.my.sion.domain.model;

import java.util.Locale;

/**
 * 왜: "이번/다음/지난", "오늘/내일/모레" 같은 상대 표현을 하나의 기준으로 정규화하기 위함.
 */
public enum RelativePeriod {
    CURRENT,
    NEXT,
    PREVIOUS,
    TODAY,
    TOMORROW,
    DAY_AFTER,
    NONE;

    /**
     * 영문 와이어 이름과 한국어 키워드를 모두 받는다. 인식하지 못하면 NONE.
     */
    public static RelativePeriod fromKeyword(String keyword) {
        if (keyword == null || keyword.isBlank()) {
            return NONE;
        }
        String normalized = keyword.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "current", "this", "이번" -> CURRENT;
            case "next", "다음" -> NEXT;
            case "previous", "last", "지난", "저번" -> PREVIOUS;
            case "today", "오늘" -> TODAY;
            case "tomorrow", "내일" -> TOMORROW;
            case "day_after", "day after tomorrow", "모레" -> DAY_AFTER;
            default -> NONE;
        };
    }
}
