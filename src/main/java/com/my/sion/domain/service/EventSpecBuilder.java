package com.my.sion.domain.service;

import com.my.sion.domain.model.EventRequest;
import com.my.sion.domain.model.EventSpec;
import com.my.sion.domain.model.EventUpdateRequest;
import com.my.sion.domain.model.EventUpdateSpec;
import com.my.sion.domain.model.ParsedDate;
import com.my.sion.domain.model.ParsedTime;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * 왜: 제목/날짜/시각/기간/종일 여부/반복 값을 캘린더 등록·수정 요청 값으로 확정하기 위함. 네트워크나 저장은 하지 않는다.
 *
 * <ul>
 *     <li>종료일이 있으면(여러 날) 종일 일정 [시작일, 종료일 + 1일)</li>
 *     <li>여러 날 요청에서 어느 한쪽이라도 해석에 실패하면 시작일 하루짜리 종일 일정</li>
 *     <li>종일이거나 시각이 없으면 시작일 하루짜리 종일 일정</li>
 *     <li>그 외에는 시작 시각 + 기간(분)</li>
 * </ul>
 */
public class EventSpecBuilder {

    public static final int DEFAULT_DURATION_MINUTES = 60;
    static final String DEFAULT_TITLE = "새 일정";

    private final DateTimeParser dateTimeParser;
    private final int defaultDurationMinutes;

    public EventSpecBuilder(DateTimeParser dateTimeParser) {
        this(dateTimeParser, DEFAULT_DURATION_MINUTES);
    }

    public EventSpecBuilder(DateTimeParser dateTimeParser, int defaultDurationMinutes) {
        this.dateTimeParser = Objects.requireNonNull(dateTimeParser, "dateTimeParser");
        if (defaultDurationMinutes <= 0) {
            throw new IllegalArgumentException("기본 일정 길이는 1분 이상이어야 합니다: " + defaultDurationMinutes);
        }
        this.defaultDurationMinutes = defaultDurationMinutes;
    }

    public EventSpec build(EventRequest request, LocalDate today) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(today, "today");
        String title = titleOf(request.title());
        ParsedDate parsedStart = dateTimeParser.parseDate(request.startDate(), today);
        LocalDate startDate = parsedStart.date();

        if (isPresent(request.endDate())) {
            ParsedDate parsedEnd = dateTimeParser.parseDate(request.endDate(), today);
            if (parsedStart.defaulted() || parsedEnd.defaulted()) {
                return EventSpec.allDay(title, startDate, startDate.plusDays(1), request.recurrence());
            }
            LocalDate endDate = parsedEnd.date();
            if (endDate.isBefore(startDate)) {
                endDate = startDate;
            }
            return EventSpec.allDay(title, startDate, endDate.plusDays(1), request.recurrence());
        }
        if (request.allDay() || !isPresent(request.time())) {
            return EventSpec.allDay(title, startDate, startDate.plusDays(1), request.recurrence());
        }

        ParsedTime time = dateTimeParser.parseTime(request.time());
        LocalDateTime start = startDate.atTime(time.toLocalTime());
        return EventSpec.timed(title, start, start.plusMinutes(durationOf(request.durationMinutes())), request.recurrence());
    }

    /**
     * 날짜/시각 중 하나만 바뀌면 나머지는 현재 시작 시각에서 가져오고, 원래 길이를 유지한다.
     */
    public EventUpdateSpec buildUpdate(EventUpdateRequest request,
                                       LocalDateTime currentStart,
                                       LocalDateTime currentEnd,
                                       LocalDate today) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(today, "today");
        String newTitle = isPresent(request.newTitle()) ? request.newTitle().trim() : null;
        if (!request.changesSchedule()) {
            return new EventUpdateSpec(request.searchQuery(), newTitle, null, null);
        }

        LocalDate date;
        if (isPresent(request.newDate())) {
            date = dateTimeParser.parseDate(request.newDate(), today).date();
        } else if (currentStart != null) {
            date = currentStart.toLocalDate();
        } else {
            date = today;
        }

        LocalDateTime start;
        if (isPresent(request.newTime())) {
            start = date.atTime(dateTimeParser.parseTime(request.newTime()).toLocalTime());
        } else if (currentStart != null) {
            start = date.atTime(currentStart.toLocalTime());
        } else {
            start = date.atTime(ParsedTime.DEFAULT.toLocalTime());
        }

        Duration length = Duration.ofMinutes(defaultDurationMinutes);
        if (currentStart != null && currentEnd != null && !currentEnd.isBefore(currentStart)) {
            length = Duration.between(currentStart, currentEnd);
        }
        return new EventUpdateSpec(request.searchQuery(), newTitle, start, start.plus(length));
    }

    private int durationOf(Integer durationMinutes) {
        return durationMinutes == null || durationMinutes <= 0 ? defaultDurationMinutes : durationMinutes;
    }

    private static String titleOf(String title) {
        return isPresent(title) ? title.trim() : DEFAULT_TITLE;
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
