package com.my.sion.domain.model;

import java.util.Objects;

/**
 * 왜: 반복 일정은 항상 횟수 상한을 갖도록 강제해 캘린더에 끝없는 쓰기가 일어나지 않게 하기 위함.
 */
public record RecurrenceSpec(RecurrenceFrequency frequency, int count) {
    public RecurrenceSpec {
        Objects.requireNonNull(frequency, "frequency");
        if (count <= 0) {
            throw new IllegalArgumentException("반복 횟수는 1 이상이어야 합니다: " + count);
        }
    }

    public String toRRule() {
        return "RRULE:FREQ=" + frequency.name() + ";COUNT=" + count;
    }
}
