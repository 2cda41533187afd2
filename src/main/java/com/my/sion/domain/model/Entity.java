package com.my.sion.domain.model;

import java.util.Objects;

/**
 * 왜: 원문 위의 구간 정보를 값과 함께 보존해 하위 소비자가 겹치는 해석 중 하나를 고를 수 있게 하기 위함.
 */
public record Entity(EntityKind type, String value, int start, int end) {
    public Entity {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(value, "value");
        if (start < 0 || start >= end) {
            throw new IllegalArgumentException("엔티티 구간이 올바르지 않습니다: [" + start + ", " + end + ")");
        }
    }
}
