package com.my.sion.domain.service;

import com.my.sion.domain.model.AnalysisReply;
import com.my.sion.domain.model.AnalysisRequest;
import com.my.sion.domain.model.AnalysisResult;
import com.my.sion.domain.model.CalendarPlan;
import com.my.sion.domain.port.in.AnalyzeTextUseCase;
import com.my.sion.domain.port.in.PlanCalendarUseCase;
import com.my.sion.domain.port.in.ProcessAnalysisRequestUseCase;
import com.my.sion.domain.port.out.ClockPort;
import com.my.sion.domain.port.out.ReplyPort;

import java.time.OffsetDateTime;

/**
 * 왜: 메시지로 들어온 요청을 분석하고, 일정 의도나 구조화된 명령이면 캘린더 계획까지 붙여 응답 채널로 보내는 흐름을 한 곳에 두기 위함.
 */
public class ProcessAnalysisRequestService implements ProcessAnalysisRequestUseCase {

    private final AnalyzeTextUseCase analyzeTextUseCase;
    private final PlanCalendarUseCase planCalendarUseCase;
    private final ReplyPort replyPort;
    private final ClockPort clockPort;

    public ProcessAnalysisRequestService(AnalyzeTextUseCase analyzeTextUseCase,
                                         PlanCalendarUseCase planCalendarUseCase,
                                         ReplyPort replyPort,
                                         ClockPort clockPort) {
        this.analyzeTextUseCase = analyzeTextUseCase;
        this.planCalendarUseCase = planCalendarUseCase;
        this.replyPort = replyPort;
        this.clockPort = clockPort;
    }

    @Override
    public AnalysisReply process(AnalysisRequest request) {
        AnalysisResult result = analyzeTextUseCase.analyze(request.text());
        // 요청에 기준 시각이 없을 때만 시계를 읽는다.
        OffsetDateTime now = request.timestamp() != null ? request.timestamp() : clockPort.now();
        CalendarPlan plan = request.command() != null
                ? planCalendarUseCase.planCommand(request.command(), now)
                : planCalendarUseCase.plan(result, now).orElse(null);
        AnalysisReply reply = new AnalysisReply(request.requestId(), result, plan);
        replyPort.send(reply);
        return reply;
    }
}
