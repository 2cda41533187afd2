package com.my.sion.domain.model;

import java.util.Objects;

/**
 * 왜: 분류 결과와 신뢰도를 한 값으로 묶어 라우팅 계층이 임계값 판단을 일관되게 하도록 하기 위함.
 */
public record IntentMatch(Intent intent, double confidence) {
    public IntentMatch {
        Objects.requireNonNull(intent, "intent");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("신뢰도는 0과 1 사이여야 합니다: " + confidence);
        }
    }
}
