package com.my.sion.domain.service;

import com.my.sion.domain.model.EventRequest;
import com.my.sion.domain.model.EventSpec;
import com.my.sion.domain.model.EventUpdateRequest;
import com.my.sion.domain.model.EventUpdateSpec;
import com.my.sion.domain.model.RecurrenceFrequency;
import com.my.sion.domain.model.RecurrenceSpec;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventSpecBuilderTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 12, 11);

    private final EventSpecBuilder builder = new EventSpecBuilder(new DateTimeParser());

    @Test
    void multi_day_trip_is_all_day_with_exclusive_end() {
        EventSpec spec = builder.build(EventRequest.multiDay("출장", "2024-12-11", "2024-12-13"), TODAY);

        assertTrue(spec.allDay());
        assertEquals("출장", spec.title());
        assertEquals(LocalDateTime.of(2024, 12, 11, 0, 0), spec.start());
        assertEquals(LocalDateTime.of(2024, 12, 14, 0, 0), spec.end());
        assertEquals(LocalDate.of(2024, 12, 14), spec.endDate());
    }

    @Test
    void end_before_start_collapses_to_single_day() {
        EventSpec spec = builder.build(EventRequest.multiDay("출장", "2024-12-13", "2024-12-11"), TODAY);

        assertEquals(LocalDate.of(2024, 12, 13), spec.startDate());
        assertEquals(LocalDate.of(2024, 12, 14), spec.endDate());
    }

    @Test
    void unparsable_end_date_collapses_to_single_day_on_start() {
        LocalDate today = LocalDate.of(2026, 10, 19);

        EventSpec spec = builder.build(EventRequest.multiDay("출장", "2024-12-11", "다음 금요일쯤"), today);

        assertTrue(spec.allDay());
        assertEquals(LocalDate.of(2024, 12, 11), spec.startDate());
        assertEquals(LocalDate.of(2024, 12, 12), spec.endDate());
    }

    @Test
    void unparsable_start_date_collapses_to_single_day_on_today() {
        EventSpec spec = builder.build(EventRequest.multiDay("출장", "언젠가", "2024-12-20"), TODAY);

        assertEquals(TODAY, spec.startDate());
        assertEquals(TODAY.plusDays(1), spec.endDate());
    }

    @Test
    void timed_event_uses_default_duration() {
        EventSpec spec = builder.build(EventRequest.timed("회의", "내일", "오후 3시"), TODAY);

        assertFalse(spec.allDay());
        assertEquals(LocalDateTime.of(2024, 12, 12, 15, 0), spec.start());
        assertEquals(LocalDateTime.of(2024, 12, 12, 16, 0), spec.end());
    }

    @Test
    void explicit_duration_overrides_default() {
        EventRequest request = new EventRequest("회의", "내일", null, "오후 3시", 30, false, null);

        assertEquals(LocalDateTime.of(2024, 12, 12, 15, 30), builder.build(request, TODAY).end());
    }

    @Test
    void configured_default_duration_is_used() {
        EventSpecBuilder custom = new EventSpecBuilder(new DateTimeParser(), 45);

        EventSpec spec = custom.build(EventRequest.timed("회의", "오늘", "10:00"), TODAY);

        assertEquals(LocalDateTime.of(2024, 12, 11, 10, 45), spec.end());
    }

    @Test
    void missing_time_means_single_all_day() {
        EventSpec spec = builder.build(EventRequest.timed("생일", "12월 25일", null), TODAY);

        assertTrue(spec.allDay());
        assertEquals(LocalDateTime.of(2024, 12, 25, 0, 0), spec.start());
        assertEquals(LocalDateTime.of(2024, 12, 26, 0, 0), spec.end());
    }

    @Test
    void all_day_flag_ignores_time() {
        EventRequest request = new EventRequest("휴가", "2024-12-20", null, "오후 3시", null, true, null);

        assertTrue(builder.build(request, TODAY).allDay());
    }

    @Test
    void blank_title_gets_placeholder_and_bad_time_defaults_to_nine() {
        EventSpec spec = builder.build(EventRequest.timed("  ", "오늘", "저녁"), TODAY);

        assertEquals("새 일정", spec.title());
        assertEquals(LocalDateTime.of(2024, 12, 11, 9, 0), spec.start());
    }

    @Test
    void recurrence_is_carried_through() {
        RecurrenceSpec weekly = new RecurrenceSpec(RecurrenceFrequency.WEEKLY, 4);

        EventSpec spec = builder.build(EventRequest.timed("스터디", "오늘", "오후 7시").withRecurrence(weekly), TODAY);

        assertTrue(spec.isRecurring());
        assertEquals(weekly, spec.recurrence());
    }

    @Test
    void invalid_default_duration_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new EventSpecBuilder(new DateTimeParser(), 0));
    }

    @Test
    void update_moves_date_and_keeps_time_and_length() {
        EventUpdateRequest request = new EventUpdateRequest("회의", null, "내일", null);

        EventUpdateSpec spec = builder.buildUpdate(request,
                LocalDateTime.of(2024, 12, 11, 14, 0), LocalDateTime.of(2024, 12, 11, 15, 30), TODAY);

        assertEquals(LocalDateTime.of(2024, 12, 12, 14, 0), spec.start());
        assertEquals(LocalDateTime.of(2024, 12, 12, 15, 30), spec.end());
        assertNull(spec.title());
    }

    @Test
    void update_changes_time_on_current_date() {
        EventUpdateRequest request = new EventUpdateRequest("회의", null, null, "오후 5시");

        EventUpdateSpec spec = builder.buildUpdate(request,
                LocalDateTime.of(2024, 12, 11, 14, 0), LocalDateTime.of(2024, 12, 11, 15, 30), TODAY);

        assertEquals(LocalDateTime.of(2024, 12, 11, 17, 0), spec.start());
        assertEquals(LocalDateTime.of(2024, 12, 11, 18, 30), spec.end());
    }

    @Test
    void update_without_current_times_uses_defaults() {
        EventUpdateRequest request = new EventUpdateRequest("회의", null, "모레", null);

        EventUpdateSpec spec = builder.buildUpdate(request, null, null, TODAY);

        assertEquals(LocalDateTime.of(2024, 12, 13, 9, 0), spec.start());
        assertEquals(LocalDateTime.of(2024, 12, 13, 10, 0), spec.end());
    }

    @Test
    void title_only_update_leaves_schedule_untouched() {
        EventUpdateSpec spec = builder.buildUpdate(new EventUpdateRequest("회의", " 주간 회의 ", null, null),
                null, null, TODAY);

        assertEquals("주간 회의", spec.title());
        assertNull(spec.start());
        assertNull(spec.end());
        assertTrue(spec.hasChanges());
    }

    @Test
    void empty_update_has_no_changes() {
        EventUpdateSpec spec = builder.buildUpdate(new EventUpdateRequest("회의", null, "", null), null, null, TODAY);

        assertThat(spec.hasChanges()).isFalse();
        assertEquals("회의", spec.searchQuery());
    }
}
