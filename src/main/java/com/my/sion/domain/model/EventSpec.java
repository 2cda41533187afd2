package com.my.sion.domain.model;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * 왜: 캘린더 등록에 필요한 값을 모두 확정한 상태로 넘겨 어댑터가 추가 해석 없이 요청을 만들게 하기 위함.
 * 종일 일정은 자정에 시작하고 마지막 날 다음 날 자정에 끝난다(배타).
 */
public record EventSpec(
        String title,
        LocalDateTime start,
        LocalDateTime end,
        boolean allDay,
        RecurrenceSpec recurrence
) {
    public EventSpec {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (title.isBlank()) {
            throw new IllegalArgumentException("이벤트 제목은 비어 있을 수 없습니다.");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("종료 시간이 시작 시간보다 이를 수 없습니다.");
        }
    }

    public static EventSpec allDay(String title, LocalDate firstDay, LocalDate endExclusive, RecurrenceSpec recurrence) {
        return new EventSpec(title, firstDay.atStartOfDay(), endExclusive.atStartOfDay(), true, recurrence);
    }

    public static EventSpec timed(String title, LocalDateTime start, LocalDateTime end, RecurrenceSpec recurrence) {
        return new EventSpec(title, start, end, false, recurrence);
    }

    public LocalDate startDate() {
        return start.toLocalDate();
    }

    public LocalDate endDate() {
        return end.toLocalDate();
    }

    public boolean isRecurring() {
        return recurrence != null;
    }
}
