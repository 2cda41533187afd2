package com.my.sion.domain.model;

import java.util.Objects;

/**
 * 왜: 일정 의도별로 캘린더 협력자에게 넘길 값(조회 기간, 등록 이벤트, 검색어, 수정 값)을 하나의 결과로 묶기 위함.
 */
public record CalendarPlan(Intent intent, DateRange range, EventSpec event, String searchQuery, EventUpdateSpec update) {
    public CalendarPlan {
        Objects.requireNonNull(intent, "intent");
        if (!intent.isCalendar()) {
            throw new IllegalArgumentException("일정 의도가 아닙니다: " + intent.wireName());
        }
    }

    public static CalendarPlan query(DateRange range) {
        return new CalendarPlan(Intent.SCHEDULE_CHECK, range, null, null, null);
    }

    public static CalendarPlan create(EventSpec event) {
        return new CalendarPlan(Intent.SCHEDULE_ADD, null, event, null, null);
    }

    public static CalendarPlan lookup(Intent intent, DateRange range, String searchQuery) {
        return new CalendarPlan(intent, range, null, searchQuery, null);
    }

    public static CalendarPlan update(EventUpdateSpec update) {
        return new CalendarPlan(Intent.SCHEDULE_UPDATE, null, null, update.searchQuery(), update);
    }
}
