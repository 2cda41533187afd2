package com.my.sion.domain.service;

import com.my.sion.domain.model.AnalysisReply;
import com.my.sion.domain.model.AnalysisRequest;
import com.my.sion.domain.model.AnalysisResult;
import com.my.sion.domain.model.CalendarCommand;
import com.my.sion.domain.model.CalendarPlan;
import com.my.sion.domain.model.DateRange;
import com.my.sion.domain.model.Intent;
import com.my.sion.domain.model.IntentMatch;
import com.my.sion.domain.model.PeriodQuery;
import com.my.sion.domain.model.RelativePeriod;
import com.my.sion.domain.port.in.AnalyzeTextUseCase;
import com.my.sion.domain.port.in.PlanCalendarUseCase;
import com.my.sion.domain.port.out.ClockPort;
import com.my.sion.domain.port.out.ReplyPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ProcessAnalysisRequestServiceTest {

    private AnalyzeTextUseCase analyzeTextUseCase;
    private PlanCalendarUseCase planCalendarUseCase;
    private ReplyPort replyPort;
    private ClockPort clockPort;
    private ProcessAnalysisRequestService service;

    @BeforeEach
    void setUp() {
        analyzeTextUseCase = mock(AnalyzeTextUseCase.class);
        planCalendarUseCase = mock(PlanCalendarUseCase.class);
        replyPort = mock(ReplyPort.class);
        clockPort = mock(ClockPort.class);
        service = new ProcessAnalysisRequestService(analyzeTextUseCase, planCalendarUseCase, replyPort, clockPort);
    }

    @Test
    void calendar_request_attaches_plan_and_replies() {
        OffsetDateTime timestamp = OffsetDateTime.parse("2024-12-11T10:00:00+09:00");
        AnalysisRequest req = new AnalysisRequest("req-1", timestamp, "오늘 일정 알려줘");
        AnalysisResult result = new AnalysisResult(req.text(), new IntentMatch(Intent.SCHEDULE_CHECK, 0.42), List.of());
        LocalDate today = LocalDate.of(2024, 12, 11);
        CalendarPlan plan = CalendarPlan.query(new DateRange(today, today, "오늘"));
        when(analyzeTextUseCase.analyze(req.text())).thenReturn(result);
        when(planCalendarUseCase.plan(result, timestamp)).thenReturn(Optional.of(plan));

        AnalysisReply reply = service.process(req);

        verify(replyPort).send(reply);
        verify(clockPort, never()).now();
        assertEquals("req-1", reply.requestId());
        assertEquals(plan, reply.plan());
    }

    @Test
    void missing_timestamp_reads_clock() {
        OffsetDateTime now = OffsetDateTime.parse("2024-12-11T10:00:00+09:00");
        AnalysisRequest req = new AnalysisRequest("req-2", null, "날씨 어때");
        AnalysisResult result = new AnalysisResult(req.text(), new IntentMatch(Intent.WEATHER_CHECK, 0.5), List.of());
        when(clockPort.now()).thenReturn(now);
        when(analyzeTextUseCase.analyze(req.text())).thenReturn(result);
        when(planCalendarUseCase.plan(result, now)).thenReturn(Optional.empty());

        AnalysisReply reply = service.process(req);

        verify(planCalendarUseCase).plan(result, now);
        verify(replyPort).send(reply);
        assertNull(reply.plan());
        assertEquals(result, reply.result());
    }

    @Test
    void structured_command_is_planned_instead_of_text() {
        OffsetDateTime timestamp = OffsetDateTime.parse("2024-12-11T10:00:00+09:00");
        CalendarCommand command = CalendarCommand.query(PeriodQuery.week(RelativePeriod.NEXT));
        AnalysisRequest req = new AnalysisRequest("req-3", timestamp, "다음 주 일정 알려줘", command);
        AnalysisResult result = new AnalysisResult(req.text(), new IntentMatch(Intent.SCHEDULE_CHECK, 0.42), List.of());
        CalendarPlan plan = CalendarPlan.query(
                new DateRange(LocalDate.of(2024, 12, 16), LocalDate.of(2024, 12, 22), "다음 주"));
        when(analyzeTextUseCase.analyze(req.text())).thenReturn(result);
        when(planCalendarUseCase.planCommand(command, timestamp)).thenReturn(plan);

        AnalysisReply reply = service.process(req);

        verify(planCalendarUseCase).planCommand(command, timestamp);
        verify(planCalendarUseCase, never()).plan(any(AnalysisResult.class), any());
        verify(replyPort).send(reply);
        assertEquals(plan, reply.plan());
        assertEquals(result, reply.result());
    }
}
