package com.my.sion.config;

import com.my.sion.domain.service.RecurrenceBuilder;
import io.quarkus.runtime.LaunchMode;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * 왜: 잘못된 설정을 첫 요청이 아니라 기동 시점에 드러내기 위함. 운영 프로필에서는 기동을 중단하고, 그 외에는 경고만 남긴다.
 */
@Startup
@ApplicationScoped
public class ConfigValidator {

    private static final Logger log = Logger.getLogger(ConfigValidator.class);

    static final String CLASSPATH_PREFIX = "classpath:";

    private final AppConfig appConfig;

    public ConfigValidator(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    @PostConstruct
    void validate() {
        boolean isProd = LaunchMode.current() == LaunchMode.NORMAL;
        for (String problem : findProblems()) {
            if (isProd) {
                throw new IllegalStateException(problem);
            }
            log.warn(problem);
        }
    }

    List<String> findProblems() {
        List<String> problems = new ArrayList<>();
        try {
            ZoneId.of(appConfig.nlu().zoneId());
        } catch (DateTimeException e) {
            problems.add("시간대 설정이 올바르지 않습니다: app.nlu.zone-id=" + appConfig.nlu().zoneId());
        }
        String classifier = appConfig.nlu().classifier();
        if (!"rules".equals(classifier) && !"openai".equals(classifier)) {
            problems.add("알 수 없는 분류기 설정입니다: app.nlu.classifier=" + classifier);
        }
        if ("openai".equals(classifier) && appConfig.openai().apiKey().filter(key -> !key.isBlank()).isEmpty()) {
            problems.add("필수 설정이 비어 있습니다: OPENAI_API_KEY");
        }
        appConfig.nlu().rulesPath()
                .filter(path -> !path.isBlank() && !path.startsWith(CLASSPATH_PREFIX))
                .filter(path -> !Files.exists(Path.of(path)))
                .ifPresent(path -> problems.add("경로가 존재하지 않습니다: app.nlu.rules-path=" + path));
        if (appConfig.calendar().defaultDurationMinutes() <= 0) {
            problems.add("기본 일정 길이는 1분 이상이어야 합니다: " + appConfig.calendar().defaultDurationMinutes());
        }
        int recurrenceCount = appConfig.calendar().defaultRecurrenceCount();
        if (recurrenceCount <= 0 || recurrenceCount > RecurrenceBuilder.MAX_COUNT) {
            problems.add("기본 반복 횟수는 1~" + RecurrenceBuilder.MAX_COUNT + " 사이여야 합니다: " + recurrenceCount);
        }
        return problems;
    }
}
