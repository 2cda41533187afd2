package com.my.sion.domain.model;

import java.util.Objects;

/**
 * 왜: 기존 일정 수정 요청(검색어 + 바꿀 값)을 구조화하기 위함. 비어 있는 필드는 변경하지 않는다.
 */
public record EventUpdateRequest(String searchQuery, String newTitle, String newDate, String newTime) {
    public EventUpdateRequest {
        Objects.requireNonNull(searchQuery, "searchQuery");
    }

    public boolean changesSchedule() {
        return isPresent(newDate) || isPresent(newTime);
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
