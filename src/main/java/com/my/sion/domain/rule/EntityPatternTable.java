package com.my.sion.domain.rule;

import com.my.sion.domain.model.EntityKind;

import java.util.List;
import java.util.Objects;

/**
 * 왜: 엔티티 패턴을 기동 시 한 번 만들어 불변으로 공유하기 위함.
 */
public final class EntityPatternTable {

    private final List<EntityRule> rules;

    public EntityPatternTable(List<EntityRule> rules) {
        Objects.requireNonNull(rules, "rules");
        this.rules = List.copyOf(rules);
    }

    public List<EntityRule> rules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    public static EntityPatternTable defaults() {
        return new EntityPatternTable(List.of(
                // am/pm, 오전/오후 형태를 앞에 두어 "오후 3시"가 "3시"보다 먼저 잡히게 한다.
                EntityRule.of(EntityKind.TIME,
                        "(\\d{1,2}(?::\\d{2})?\\s*(?:am|pm)"
                                + "|오전\\s*\\d{1,2}시(?:\\s*\\d{1,2}분|\\s*반)?"
                                + "|오후\\s*\\d{1,2}시(?:\\s*\\d{1,2}분|\\s*반)?"
                                + "|\\d{1,2}시(?:\\s*\\d{1,2}분|\\s*반)?"
                                + "|\\d{1,2}:\\d{2})"),
                EntityRule.of(EntityKind.DATE,
                        "(오늘|내일|모레|\\d{4}년\\s*\\d{1,2}월\\s*\\d{1,2}일|\\d{1,2}월\\s*\\d{1,2}일|지난\\s*주|다음\\s*주|이번\\s*주)",
                        "(\\d{4}[-/]\\d{1,2}[-/]\\d{1,2}|(?<![\\d/])\\d{1,2}/\\d{1,2}(?![\\d/])|(?:이번|다음|지난)\\s*달|(?<!\\d)\\d{1,2}월(?!\\s*\\d{1,2}일))"),
                EntityRule.of(EntityKind.DURATION, "(\\d+\\s*(분|시간|초))"),
                EntityRule.of(EntityKind.PERSON, "([가-힣]{2,4}(?:씨|님|에게))"),
                EntityRule.of(EntityKind.APP_NAME, "(크롬|브라우저|메모장|계산기|엑셀|워드|파워포인트|비주얼\\s*스튜디오)"),
                EntityRule.of(EntityKind.FILE_NAME, "([가-힣a-zA-Z0-9_]+\\.(docx|doc|txt|pdf|xlsx|pptx|py|js))")
        ));
    }
}
