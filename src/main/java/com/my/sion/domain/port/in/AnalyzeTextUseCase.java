package com.my.sion.domain.port.in;

import com.my.sion.domain.model.AnalysisResult;

import java.util.Map;

/**
 * 왜: 라우팅 계층이 의도와 엔티티를 한 번의 호출로 얻도록 분석 진입점을 하나로 모으기 위함.
 */
public interface AnalyzeTextUseCase {
    AnalysisResult analyze(String text);

    /**
     * 와이어 이름 → 설명. 분류기가 낼 수 있는 전체 의도 목록.
     */
    Map<String, String> supportedIntents();
}
