package com.my.sion.config;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.Optional;

@StaticInitSafe
@ConfigMapping(prefix = "app")
public interface AppConfig {

    NluConfig nlu();

    CalendarConfig calendar();

    OpenAiConfig openai();

    interface NluConfig {
        @WithName("zone-id")
        @WithDefault("Asia/Seoul")
        String zoneId();

        /**
         * rules | openai. 빌드 속성으로도 쓰이므로 런타임에 바꿔도 분류기 구현은 바뀌지 않는다.
         */
        @WithDefault("rules")
        String classifier();

        @WithName("rules-path")
        Optional<String> rulesPath();
    }

    interface CalendarConfig {
        @WithName("default-duration-minutes")
        @WithDefault("60")
        int defaultDurationMinutes();

        @WithName("default-recurrence-count")
        @WithDefault("10")
        int defaultRecurrenceCount();
    }

    interface OpenAiConfig {
        @WithName("api-key")
        Optional<String> apiKey();

        @WithDefault("gpt-4o-mini")
        String model();

        @WithDefault("0.0")
        double temperature();
    }
}
