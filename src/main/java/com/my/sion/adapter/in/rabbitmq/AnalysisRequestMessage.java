package com.my.sion.adapter.in.rabbitmq;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.my.sion.domain.exception.InvalidRequestException;
import com.my.sion.domain.model.AnalysisRequest;
import com.my.sion.domain.model.CalendarCommand;
import com.my.sion.domain.model.EventRequest;
import com.my.sion.domain.model.EventUpdateRequest;
import com.my.sion.domain.model.PeriodQuery;
import com.my.sion.domain.model.PeriodType;
import com.my.sion.domain.model.RelativePeriod;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;

/**
 * period/event/update는 상위 도구 호출이 채우는 선택 섹션이며, 있으면 최대 하나만 허용한다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalysisRequestMessage(String requestId,
                                     String text,
                                     String timestamp,
                                     PeriodPayload period,
                                     EventPayload event,
                                     UpdatePayload update) {

    public AnalysisRequestMessage {
        if (requestId == null || requestId.isBlank()) {
            throw new InvalidRequestException("requestId가 비어 있습니다.");
        }
        if (text == null) {
            throw new InvalidRequestException("text가 없습니다.");
        }
    }

    /**
     * timestamp는 선택값이며, 있으면 설정된 지역 시간대로 옮긴다.
     */
    public AnalysisRequest toAnalysisRequest(ZoneId zoneId) {
        return new AnalysisRequest(requestId, timestampIn(zoneId), text, toCommand());
    }

    private OffsetDateTime timestampIn(ZoneId zoneId) {
        if (timestamp == null || timestamp.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(timestamp)
                    .atZoneSameInstant(zoneId)
                    .toOffsetDateTime();
        } catch (DateTimeException e) {
            throw new InvalidRequestException("timestamp 형식이 올바르지 않습니다: " + timestamp, e);
        }
    }

    private CalendarCommand toCommand() {
        if (period == null && event == null && update == null) {
            return null;
        }
        return new CalendarCommand(
                period == null ? null : period.toPeriodQuery(),
                event == null ? null : event.toEventRequest(),
                event == null ? null : event.recurrence(),
                event == null ? null : event.count(),
                update == null ? null : update.toEventUpdateRequest(),
                update == null ? null : localDateTimeOf("currentStart", update.currentStart()),
                update == null ? null : localDateTimeOf("currentEnd", update.currentEnd())
        );
    }

    private static LocalDateTime localDateTimeOf(String field, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDateTime.parse(value.trim());
        } catch (DateTimeException e) {
            throw new InvalidRequestException(field + " 형식이 올바르지 않습니다: " + value, e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PeriodPayload(String type,
                                String relative,
                                Integer year,
                                Integer month,
                                String startDate,
                                String endDate) {
        // 알 수 없는 type은 여기서 InvalidRequestException이 된다.
        PeriodQuery toPeriodQuery() {
            return new PeriodQuery(
                    PeriodType.fromWireName(type),
                    RelativePeriod.fromKeyword(relative),
                    year,
                    month,
                    startDate,
                    endDate
            );
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EventPayload(String title,
                               String startDate,
                               String endDate,
                               String time,
                               Integer durationMinutes,
                               Boolean allDay,
                               String recurrence,
                               Integer count) {
        EventRequest toEventRequest() {
            return new EventRequest(title, startDate, endDate, time, durationMinutes, Boolean.TRUE.equals(allDay), null);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record UpdatePayload(String searchQuery,
                                String newTitle,
                                String newDate,
                                String newTime,
                                String currentStart,
                                String currentEnd) {
        EventUpdateRequest toEventUpdateRequest() {
            if (searchQuery == null) {
                throw new InvalidRequestException("update.searchQuery가 없습니다.");
            }
            return new EventUpdateRequest(searchQuery, newTitle, newDate, newTime);
        }
    }
}
