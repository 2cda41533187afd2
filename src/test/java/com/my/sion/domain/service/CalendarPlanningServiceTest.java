package com.my.sion.domain.service;

import com.my.sion.domain.model.AnalysisResult;
import com.my.sion.domain.model.CalendarCommand;
import com.my.sion.domain.model.CalendarPlan;
import com.my.sion.domain.model.EventRequest;
import com.my.sion.domain.model.EventUpdateRequest;
import com.my.sion.domain.model.Intent;
import com.my.sion.domain.model.PeriodQuery;
import com.my.sion.domain.model.PeriodType;
import com.my.sion.domain.model.RelativePeriod;
import com.my.sion.domain.rule.EntityPatternTable;
import com.my.sion.domain.rule.IntentRuleTable;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class CalendarPlanningServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2024, 12, 11, 10, 0, 0, 0, ZoneOffset.ofHours(9));

    private final TextAnalysisService analysis = new TextAnalysisService(
            new RuleBasedIntentClassifier(IntentRuleTable.defaults()),
            new EntityExtractor(EntityPatternTable.defaults()));

    private final DateTimeParser parser = new DateTimeParser();
    private final CalendarPlanningService service = new CalendarPlanningService(
            new TemporalRangeResolver(parser),
            new EventSpecBuilder(parser),
            new RecurrenceBuilder(),
            new CalendarCommandMapper());

    @Test
    void meetingRequestPlansTimedEvent() {
        Optional<CalendarPlan> plan = service.plan(analysis.analyze("내일 오후 3시에 회의 잡아줘"), NOW);

        assertThat(plan).isPresent();
        assertThat(plan.get().intent()).isEqualTo(Intent.SCHEDULE_ADD);
        assertThat(plan.get().event().title()).isEqualTo("회의");
        assertThat(plan.get().event().start()).isEqualTo(LocalDateTime.of(2024, 12, 12, 15, 0));
        assertThat(plan.get().event().end()).isEqualTo(LocalDateTime.of(2024, 12, 12, 16, 0));
        assertThat(plan.get().range()).isNull();
    }

    @Test
    void scheduleQueryPlansRange() {
        CalendarPlan plan = service.plan(analysis.analyze("다음 주 일정 알려줘"), NOW).orElseThrow();

        assertThat(plan.intent()).isEqualTo(Intent.SCHEDULE_CHECK);
        assertThat(plan.range().start()).isEqualTo(LocalDate.of(2024, 12, 16));
        assertThat(plan.range().end()).isEqualTo(LocalDate.of(2024, 12, 22));
    }

    @Test
    void previousWeekQueryPlansLastMondayToSunday() {
        CalendarPlan plan = service.plan(analysis.analyze("지난 주 일정 알려줘"), NOW).orElseThrow();

        assertThat(plan.range().start()).isEqualTo(LocalDate.of(2024, 12, 2));
        assertThat(plan.range().end()).isEqualTo(LocalDate.of(2024, 12, 8));
    }

    @Test
    void explicitYearIsKeptWhenPlanningDayQuery() {
        CalendarPlan plan = service.plan(analysis.analyze("2025년 1월 3일 일정 알려줘"), NOW).orElseThrow();

        assertThat(plan.range().start()).isEqualTo(LocalDate.of(2025, 1, 3));
        assertThat(plan.range().isSingleDay()).isTrue();
    }

    @Test
    void todayQueryPlansSingleDay() {
        CalendarPlan plan = service.plan(analysis.analyze("오늘 일정 알려줘"), NOW).orElseThrow();

        assertThat(plan.range().isSingleDay()).isTrue();
        assertThat(plan.range().start()).isEqualTo(LocalDate.of(2024, 12, 11));
    }

    @Test
    void cancellationPlansLookupWithSearchQuery() {
        CalendarPlan plan = service.plan(analysis.analyze("다음 주 회의 취소해줘"), NOW).orElseThrow();

        assertThat(plan.intent()).isEqualTo(Intent.SCHEDULE_DELETE);
        assertThat(plan.searchQuery()).isEqualTo("회의");
        assertThat(plan.range().start()).isEqualTo(LocalDate.of(2024, 12, 16));
        assertThat(plan.event()).isNull();
    }

    @Test
    void nonCalendarIntentHasNoPlan() {
        AnalysisResult result = analysis.analyze("날씨 어때");

        assertThat(service.plan(result, NOW)).isEmpty();
    }

    @Test
    void anchorIsLocalDateOfNow() {
        OffsetDateTime lateNight = OffsetDateTime.of(2024, 12, 31, 23, 30, 0, 0, ZoneOffset.ofHours(9));

        assertThat(service.resolveRange(PeriodQuery.day(RelativePeriod.TOMORROW), lateNight).start())
                .isEqualTo(LocalDate.of(2025, 1, 1));
    }

    @Test
    void recurrenceIsDelegated() {
        assertThat(service.buildRecurrence("매주", 3)).map(spec -> spec.toRRule()).contains("RRULE:FREQ=WEEKLY;COUNT=3");
    }

    @Test
    void periodCommandResolvesRange() {
        CalendarPlan plan = service.planCommand(
                CalendarCommand.query(new PeriodQuery(PeriodType.fromWireName("month"), RelativePeriod.NONE, 2025, 2, null, null)),
                NOW);

        assertThat(plan.intent()).isEqualTo(Intent.SCHEDULE_CHECK);
        assertThat(plan.range().start()).isEqualTo(LocalDate.of(2025, 2, 1));
        assertThat(plan.range().end()).isEqualTo(LocalDate.of(2025, 2, 28));
    }

    @Test
    void eventCommandBuildsRecurringEvent() {
        EventRequest request = new EventRequest("스터디", "2024-12-12", null, "19:00", 90, false, null);

        CalendarPlan plan = service.planCommand(CalendarCommand.create(request, "weekly", 8), NOW);

        assertThat(plan.intent()).isEqualTo(Intent.SCHEDULE_ADD);
        assertThat(plan.event().start()).isEqualTo(LocalDateTime.of(2024, 12, 12, 19, 0));
        assertThat(plan.event().end()).isEqualTo(LocalDateTime.of(2024, 12, 12, 20, 30));
        assertThat(plan.event().recurrence().toRRule()).isEqualTo("RRULE:FREQ=WEEKLY;COUNT=8");
    }

    @Test
    void eventCommandWithUnknownFrequencyDoesNotRepeat() {
        EventRequest request = EventRequest.timed("스터디", "2024-12-12", "19:00");

        CalendarPlan plan = service.planCommand(CalendarCommand.create(request, "fortnightly", 3), NOW);

        assertThat(plan.event().isRecurring()).isFalse();
    }

    @Test
    void updateCommandKeepsOriginalLength() {
        CalendarCommand command = CalendarCommand.update(
                new EventUpdateRequest("회의", null, null, "16:00"),
                LocalDateTime.of(2024, 12, 12, 15, 0),
                LocalDateTime.of(2024, 12, 12, 16, 30));

        CalendarPlan plan = service.planCommand(command, NOW);

        assertThat(plan.intent()).isEqualTo(Intent.SCHEDULE_UPDATE);
        assertThat(plan.searchQuery()).isEqualTo("회의");
        assertThat(plan.update().start()).isEqualTo(LocalDateTime.of(2024, 12, 12, 16, 0));
        assertThat(plan.update().end()).isEqualTo(LocalDateTime.of(2024, 12, 12, 17, 30));
    }
}
