package com.my.sion.adapter.out.rules;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * 왜: 외부 JSON 규칙 파일의 구조를 고정하기 위함. 비어 있는 절은 기본 테이블을 쓴다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RuleTableDocument(List<IntentRuleEntry> intents, List<EntityRuleEntry> entities) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record IntentRuleEntry(String intent, List<String> patterns) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EntityRuleEntry(String kind, List<String> patterns) {
    }
}
