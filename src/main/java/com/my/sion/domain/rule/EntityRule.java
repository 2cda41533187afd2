package com.my.sion.domain.rule;

import com.my.sion.domain.model.EntityKind;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 왜: 엔티티 종류별 패턴 순서를 고정해 같은 종류 안에서의 출력 순서를 결정적으로 만들기 위함.
 */
public record EntityRule(EntityKind kind, List<Pattern> patterns) {

    static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    public EntityRule {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(patterns, "patterns");
        if (patterns.isEmpty()) {
            throw new IllegalArgumentException("패턴이 없는 엔티티 규칙입니다: " + kind.wireName());
        }
        patterns = List.copyOf(patterns);
    }

    public static EntityRule of(EntityKind kind, String... regexes) {
        return new EntityRule(kind, Arrays.stream(regexes)
                .map(regex -> Pattern.compile(regex, FLAGS))
                .toList());
    }

    public static EntityRule of(EntityKind kind, List<String> regexes) {
        return of(kind, regexes.toArray(String[]::new));
    }
}
