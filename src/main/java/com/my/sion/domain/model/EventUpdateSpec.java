package com.my.sion.domain.model;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * 왜: 수정 요청을 확정 값으로 바꿔 어댑터가 null 여부만으로 변경 필드를 판단하게 하기 위함.
 */
public record EventUpdateSpec(String searchQuery, String title, LocalDateTime start, LocalDateTime end) {
    public EventUpdateSpec {
        Objects.requireNonNull(searchQuery, "searchQuery");
        if (start != null && end != null && end.isBefore(start)) {
            throw new IllegalArgumentException("종료 시간이 시작 시간보다 이를 수 없습니다.");
        }
    }

    public boolean hasChanges() {
        return title != null || start != null;
    }
}
