package com.my.sion.domain.service;

import com.my.sion.domain.model.RecurrenceFrequency;
import com.my.sion.domain.model.RecurrenceSpec;

import java.util.Optional;

/**
 * 왜: 반복 키워드와 횟수를 항상 유한한 반복 규칙으로 바꿔, 캘린더에 끝없는 반복 쓰기가 생기지 않도록 하기 위함.
 */
public class RecurrenceBuilder {

    public static final int DEFAULT_COUNT = 10;
    public static final int MAX_COUNT = 365;

    private final int defaultCount;

    public RecurrenceBuilder() {
        this(DEFAULT_COUNT);
    }

    public RecurrenceBuilder(int defaultCount) {
        if (defaultCount <= 0 || defaultCount > MAX_COUNT) {
            throw new IllegalArgumentException("기본 반복 횟수는 1~" + MAX_COUNT + " 사이여야 합니다: " + defaultCount);
        }
        this.defaultCount = defaultCount;
    }

    /**
     * 알 수 없는 키워드는 오류가 아니라 "반복 없음"으로 본다.
     */
    public Optional<RecurrenceSpec> build(String frequencyKeyword, Integer count) {
        return RecurrenceFrequency.fromKeyword(frequencyKeyword)
                .map(frequency -> new RecurrenceSpec(frequency, boundedCount(count)));
    }

    private int boundedCount(Integer count) {
        if (count == null || count <= 0) {
            return defaultCount;
        }
        return Math.min(count, MAX_COUNT);
    }
}
