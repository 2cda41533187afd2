package com.my.sion.config;

import com.my.sion.adapter.out.clock.OffsetClockAdapter;
import com.my.sion.adapter.out.rules.RuleTableLoader;
import com.my.sion.domain.port.in.AnalyzeTextUseCase;
import com.my.sion.domain.port.in.PlanCalendarUseCase;
import com.my.sion.domain.port.in.ProcessAnalysisRequestUseCase;
import com.my.sion.domain.port.out.ClockPort;
import com.my.sion.domain.port.out.IntentClassifier;
import com.my.sion.domain.port.out.ReplyPort;
import com.my.sion.domain.service.CalendarCommandMapper;
import com.my.sion.domain.service.CalendarPlanningService;
import com.my.sion.domain.service.DateTimeParser;
import com.my.sion.domain.service.EntityExtractor;
import com.my.sion.domain.service.EventSpecBuilder;
import com.my.sion.domain.service.ProcessAnalysisRequestService;
import com.my.sion.domain.service.RecurrenceBuilder;
import com.my.sion.domain.service.RuleBasedIntentClassifier;
import com.my.sion.domain.service.TemporalRangeResolver;
import com.my.sion.domain.service.TextAnalysisService;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

import java.time.ZoneId;

/**
 * 왜: 도메인 서비스와 포트 구현을 명시적으로 연결하여 헥사고날 구조를 보장하기 위함.
 * 도메인 서비스는 프레임워크를 모르므로 규칙 테이블과 설정값은 여기서만 주입된다.
 */
@ApplicationScoped
public class DomainConfig {

    /**
     * 다른 분류기 빈(예: OpenAI)이 활성화되면 이 기본 빈은 물러난다.
     */
    @Produces
    @DefaultBean
    @ApplicationScoped
    public IntentClassifier intentClassifier(RuleTableLoader ruleTableLoader) {
        return new RuleBasedIntentClassifier(ruleTableLoader.intentRuleTable());
    }

    @Produces
    @ApplicationScoped
    public EntityExtractor entityExtractor(RuleTableLoader ruleTableLoader) {
        return new EntityExtractor(ruleTableLoader.entityPatternTable());
    }

    @Produces
    @ApplicationScoped
    public DateTimeParser dateTimeParser() {
        return new DateTimeParser();
    }

    @Produces
    @ApplicationScoped
    public AnalyzeTextUseCase analyzeTextUseCase(IntentClassifier intentClassifier, EntityExtractor entityExtractor) {
        return new TextAnalysisService(intentClassifier, entityExtractor);
    }

    @Produces
    @ApplicationScoped
    public PlanCalendarUseCase planCalendarUseCase(DateTimeParser dateTimeParser, AppConfig appConfig) {
        return new CalendarPlanningService(
                new TemporalRangeResolver(dateTimeParser),
                new EventSpecBuilder(dateTimeParser, appConfig.calendar().defaultDurationMinutes()),
                new RecurrenceBuilder(appConfig.calendar().defaultRecurrenceCount()),
                new CalendarCommandMapper()
        );
    }

    @Produces
    @ApplicationScoped
    public ProcessAnalysisRequestUseCase processAnalysisRequestUseCase(AnalyzeTextUseCase analyzeTextUseCase,
                                                                       PlanCalendarUseCase planCalendarUseCase,
                                                                       ReplyPort replyPort,
                                                                       ClockPort clockPort) {
        return new ProcessAnalysisRequestService(analyzeTextUseCase, planCalendarUseCase, replyPort, clockPort);
    }

    @Produces
    @ApplicationScoped
    public ClockPort clockPort(AppConfig appConfig) {
        return OffsetClockAdapter.system(ZoneId.of(appConfig.nlu().zoneId()));
    }
}
