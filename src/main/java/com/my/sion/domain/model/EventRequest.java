package com.my.sion.domain.model;

/**
 * 왜: 일정 추가 도구 호출 페이로드를 원시 토큰 그대로 받아 날짜/시간 해석을 빌더 한 곳에 모으기 위함.
 */
public record EventRequest(
        String title,
        String startDate,
        String endDate,
        String time,
        Integer durationMinutes,
        boolean allDay,
        RecurrenceSpec recurrence
) {
    public static EventRequest timed(String title, String date, String time) {
        return new EventRequest(title, date, null, time, null, false, null);
    }

    public static EventRequest multiDay(String title, String startDate, String endDate) {
        return new EventRequest(title, startDate, endDate, null, null, true, null);
    }

    public EventRequest withRecurrence(RecurrenceSpec recurrenceSpec) {
        return new EventRequest(title, startDate, endDate, time, durationMinutes, allDay, recurrenceSpec);
    }
}
