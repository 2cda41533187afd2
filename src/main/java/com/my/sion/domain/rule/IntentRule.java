package com.my.sion.domain.rule;

import com.my.sion.domain.model.Intent;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 왜: 의도 하나에 대한 키워드 패턴 묶음을 불변으로 보관해 점수 계산의 분모(패턴 수)를 고정하기 위함.
 */
public record IntentRule(Intent intent, List<Pattern> patterns) {
    public IntentRule {
        Objects.requireNonNull(intent, "intent");
        Objects.requireNonNull(patterns, "patterns");
        if (patterns.isEmpty()) {
            throw new IllegalArgumentException("패턴이 없는 의도 규칙입니다: " + intent.wireName());
        }
        patterns = List.copyOf(patterns);
    }

    public static IntentRule of(Intent intent, String... regexes) {
        return new IntentRule(intent, compile(regexes));
    }

    public static IntentRule of(Intent intent, List<String> regexes) {
        return of(intent, regexes.toArray(String[]::new));
    }

    /**
     * 매칭된 패턴 수 / 전체 패턴 수. 입력은 이미 소문자로 정규화되어 있어야 한다.
     */
    public double score(String normalizedText) {
        long matched = patterns.stream()
                .filter(pattern -> pattern.matcher(normalizedText).find())
                .count();
        return (double) matched / patterns.size();
    }

    private static List<Pattern> compile(String... regexes) {
        return Arrays.stream(regexes)
                .map(Pattern::compile)
                .toList();
    }
}
