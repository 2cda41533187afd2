package com.my.sion.domain.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 왜: 한 번의 분석 결과(의도 + 엔티티)를 불변 값으로 고정해 라우팅과 일정 계획 단계가 같은 입력을 보도록 하기 위함.
 */
public record AnalysisResult(String text, IntentMatch intent, List<Entity> entities) {
    public AnalysisResult {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(intent, "intent");
        entities = entities == null ? List.of() : List.copyOf(entities);
    }

    /**
     * 왜: 하위 소비자는 종류별 첫 번째 매치를 대표값으로 쓰므로 그 규칙을 한 곳에 둔다.
     */
    public Optional<Entity> firstEntity(EntityKind kind) {
        return entities.stream()
                .filter(entity -> entity.type() == kind)
                .findFirst();
    }

    public Optional<String> firstValue(EntityKind kind) {
        return firstEntity(kind).map(Entity::value);
    }
}
