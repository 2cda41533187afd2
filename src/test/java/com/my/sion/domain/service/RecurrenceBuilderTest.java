package com.my.sion.domain.service;

import com.my.sion.domain.model.RecurrenceFrequency;
import com.my.sion.domain.model.RecurrenceSpec;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RecurrenceBuilderTest {

    private final RecurrenceBuilder builder = new RecurrenceBuilder();

    @Test
    void buildsRuleFromKeywordAndCount() {
        Optional<RecurrenceSpec> spec = builder.build("weekly", 5);

        assertThat(spec).contains(new RecurrenceSpec(RecurrenceFrequency.WEEKLY, 5));
        assertThat(spec.get().toRRule()).isEqualTo("RRULE:FREQ=WEEKLY;COUNT=5");
    }

    @Test
    void koreanKeywordsAreRecognized() {
        assertThat(builder.build("매년", 3)).map(RecurrenceSpec::frequency).contains(RecurrenceFrequency.YEARLY);
        assertThat(builder.build("매달", 3)).map(RecurrenceSpec::frequency).contains(RecurrenceFrequency.MONTHLY);
        assertThat(builder.build("매일", 3)).map(RecurrenceSpec::frequency).contains(RecurrenceFrequency.DAILY);
    }

    @Test
    void missingOrNonPositiveCountUsesDefault() {
        assertThat(builder.build("monthly", null)).map(RecurrenceSpec::count).contains(10);
        assertThat(builder.build("monthly", 0)).map(RecurrenceSpec::count).contains(10);
        assertThat(builder.build("monthly", -4)).map(RecurrenceSpec::count).contains(10);
    }

    @Test
    void countIsCapped() {
        assertThat(builder.build("daily", 1000)).map(RecurrenceSpec::count).contains(RecurrenceBuilder.MAX_COUNT);
    }

    @Test
    void unknownKeywordMeansNoRecurrence() {
        assertThat(builder.build("hourly", 3)).isEmpty();
        assertThat(builder.build(null, 3)).isEmpty();
    }

    @Test
    void configuredDefaultCountIsUsed() {
        assertThat(new RecurrenceBuilder(4).build("weekly", null)).map(RecurrenceSpec::count).contains(4);
    }

    @Test
    void invalidDefaultCountIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new RecurrenceBuilder(0));
        assertThrows(IllegalArgumentException.class, () -> new RecurrenceBuilder(RecurrenceBuilder.MAX_COUNT + 1));
    }
}
