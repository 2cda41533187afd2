package com.my.sion.domain.port.out;

import com.my.sion.domain.model.IntentMatch;

/**
 * 왜: 규칙 기반 분류기와 학습/LLM 기반 분류기를 같은 계약 뒤에서 교체할 수 있게 하기 위함.
 * 구현은 어떤 입력에도 예외를 던지지 않아야 한다.
 */
public interface IntentClassifier {
    IntentMatch classify(String text);
}
