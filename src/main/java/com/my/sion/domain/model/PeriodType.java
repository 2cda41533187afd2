package com.my.sion.domain.model;

import com.my.sion.domain.exception.InvalidRequestException;

import java.util.Locale;

/**
 * 왜: 조회 기간 종류를 닫힌 집합으로 두어 호출자의 계약 위반을 사용자 입력 오류와 구분하기 위함.
 */
public enum PeriodType {
    DAY,
    WEEK,
    MONTH,
    RANGE;

    /**
     * 비어 있으면 null(단일 일자 기본값), 알 수 없는 값이면 계약 위반으로 거부한다.
     */
    public static PeriodType fromWireName(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("지원하지 않는 기간 종류입니다: " + name, e);
        }
    }
}
