package com.my.sion.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ConfigValidatorTest {

    private AppConfig.NluConfig nlu;
    private AppConfig.CalendarConfig calendar;
    private AppConfig.OpenAiConfig openai;
    private ConfigValidator validator;

    @BeforeEach
    void setUp() {
        AppConfig appConfig = mock(AppConfig.class);
        nlu = mock(AppConfig.NluConfig.class);
        calendar = mock(AppConfig.CalendarConfig.class);
        openai = mock(AppConfig.OpenAiConfig.class);
        when(appConfig.nlu()).thenReturn(nlu);
        when(appConfig.calendar()).thenReturn(calendar);
        when(appConfig.openai()).thenReturn(openai);
        when(nlu.zoneId()).thenReturn("Asia/Seoul");
        when(nlu.classifier()).thenReturn("rules");
        when(nlu.rulesPath()).thenReturn(Optional.empty());
        when(calendar.defaultDurationMinutes()).thenReturn(60);
        when(calendar.defaultRecurrenceCount()).thenReturn(10);
        when(openai.apiKey()).thenReturn(Optional.empty());
        validator = new ConfigValidator(appConfig);
    }

    @Test
    void defaultsAreValid() {
        assertThat(validator.findProblems()).isEmpty();
    }

    @Test
    void openAiClassifierNeedsApiKey() {
        when(nlu.classifier()).thenReturn("openai");

        assertThat(validator.findProblems()).anyMatch(problem -> problem.contains("OPENAI_API_KEY"));

        when(openai.apiKey()).thenReturn(Optional.of("sk-test"));
        assertThat(validator.findProblems()).isEmpty();
    }

    @Test
    void reportsBadZoneAndClassifier() {
        when(nlu.zoneId()).thenReturn("Mars/Olympus");
        when(nlu.classifier()).thenReturn("bert");

        assertThat(validator.findProblems()).hasSize(2);
    }

    @Test
    void rulesPathMustExistUnlessClasspath(@TempDir Path dir) throws Exception {
        when(nlu.rulesPath()).thenReturn(Optional.of(dir.resolve("missing.json").toString()));
        assertThat(validator.findProblems()).hasSize(1);

        Path file = Files.writeString(dir.resolve("rules.json"), "{}");
        when(nlu.rulesPath()).thenReturn(Optional.of(file.toString()));
        assertThat(validator.findProblems()).isEmpty();

        when(nlu.rulesPath()).thenReturn(Optional.of("classpath:rules/custom.json"));
        assertThat(validator.findProblems()).isEmpty();
    }

    @Test
    void calendarDefaultsMustBeInRange() {
        when(calendar.defaultDurationMinutes()).thenReturn(0);
        when(calendar.defaultRecurrenceCount()).thenReturn(1000);

        assertThat(validator.findProblems()).hasSize(2);
    }
}
