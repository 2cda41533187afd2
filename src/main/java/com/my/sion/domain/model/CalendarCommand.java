package com.my.sion.domain.model;

import com.my.sion.domain.exception.InvalidRequestException;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * 왜: 상위 도구 호출이 보낸 구조화된 캘린더 명령(기간 조회, 일정 추가, 일정 수정)을 텍스트 분석과 별개 경로로 넘기기 위함.
 * 한 번에 한 가지 명령만 담는다.
 */
public record CalendarCommand(
        PeriodQuery period,
        EventRequest event,
        String recurrence,
        Integer recurrenceCount,
        EventUpdateRequest update,
        LocalDateTime currentStart,
        LocalDateTime currentEnd
) {
    public CalendarCommand {
        long sections = Stream.of(period, event, update).filter(Objects::nonNull).count();
        if (sections != 1) {
            throw new InvalidRequestException("캘린더 명령은 period, event, update 중 정확히 하나여야 합니다: " + sections + "개");
        }
    }

    public static CalendarCommand query(PeriodQuery period) {
        return new CalendarCommand(period, null, null, null, null, null, null);
    }

    public static CalendarCommand create(EventRequest event, String recurrence, Integer recurrenceCount) {
        return new CalendarCommand(null, event, recurrence, recurrenceCount, null, null, null);
    }

    public static CalendarCommand update(EventUpdateRequest update, LocalDateTime currentStart, LocalDateTime currentEnd) {
        return new CalendarCommand(null, null, null, null, update, currentStart, currentEnd);
    }
}
