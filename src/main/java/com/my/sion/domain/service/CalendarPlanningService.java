package com.my.sion.domain.service;

import com.my.sion.domain.model.AnalysisResult;
import com.my.sion.domain.model.CalendarCommand;
import com.my.sion.domain.model.CalendarPlan;
import com.my.sion.domain.model.DateRange;
import com.my.sion.domain.model.EventRequest;
import com.my.sion.domain.model.EventSpec;
import com.my.sion.domain.model.EventUpdateRequest;
import com.my.sion.domain.model.EventUpdateSpec;
import com.my.sion.domain.model.PeriodQuery;
import com.my.sion.domain.model.RecurrenceSpec;
import com.my.sion.domain.port.in.PlanCalendarUseCase;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * 왜: 기간 해석, 반복 규칙, 일정 조립을 하나의 유스케이스로 묶어 캘린더 협력자가 확정 값만 받도록 하기 위함.
 */
public class CalendarPlanningService implements PlanCalendarUseCase {

    private final TemporalRangeResolver rangeResolver;
    private final EventSpecBuilder eventSpecBuilder;
    private final RecurrenceBuilder recurrenceBuilder;
    private final CalendarCommandMapper commandMapper;

    public CalendarPlanningService(TemporalRangeResolver rangeResolver,
                                   EventSpecBuilder eventSpecBuilder,
                                   RecurrenceBuilder recurrenceBuilder,
                                   CalendarCommandMapper commandMapper) {
        this.rangeResolver = rangeResolver;
        this.eventSpecBuilder = eventSpecBuilder;
        this.recurrenceBuilder = recurrenceBuilder;
        this.commandMapper = commandMapper;
    }

    @Override
    public DateRange resolveRange(PeriodQuery query, OffsetDateTime now) {
        return rangeResolver.resolve(query, today(now));
    }

    @Override
    public EventSpec buildEvent(EventRequest request, OffsetDateTime now) {
        return eventSpecBuilder.build(request, today(now));
    }

    @Override
    public Optional<RecurrenceSpec> buildRecurrence(String frequencyKeyword, Integer count) {
        return recurrenceBuilder.build(frequencyKeyword, count);
    }

    @Override
    public EventUpdateSpec buildUpdate(EventUpdateRequest request,
                                       LocalDateTime currentStart,
                                       LocalDateTime currentEnd,
                                       OffsetDateTime now) {
        return eventSpecBuilder.buildUpdate(request, currentStart, currentEnd, today(now));
    }

    @Override
    public Optional<CalendarPlan> plan(AnalysisResult result, OffsetDateTime now) {
        Objects.requireNonNull(result, "result");
        return switch (result.intent().intent()) {
            case SCHEDULE_CHECK -> Optional.of(CalendarPlan.query(
                    resolveRange(commandMapper.toPeriodQuery(result), now)));
            case SCHEDULE_ADD -> Optional.of(CalendarPlan.create(
                    buildEvent(commandMapper.toEventRequest(result), now)));
            case SCHEDULE_DELETE, SCHEDULE_UPDATE -> Optional.of(CalendarPlan.lookup(
                    result.intent().intent(),
                    resolveRange(commandMapper.toPeriodQuery(result), now),
                    commandMapper.searchQueryOf(result)));
            default -> Optional.empty();
        };
    }

    @Override
    public CalendarPlan planCommand(CalendarCommand command, OffsetDateTime now) {
        Objects.requireNonNull(command, "command");
        if (command.period() != null) {
            return CalendarPlan.query(resolveRange(command.period(), now));
        }
        if (command.event() != null) {
            RecurrenceSpec recurrence = buildRecurrence(command.recurrence(), command.recurrenceCount()).orElse(null);
            return CalendarPlan.create(buildEvent(command.event().withRecurrence(recurrence), now));
        }
        return CalendarPlan.update(buildUpdate(command.update(), command.currentStart(), command.currentEnd(), now));
    }

    private static LocalDate today(OffsetDateTime now) {
        return Objects.requireNonNull(now, "now").toLocalDate();
    }
}
