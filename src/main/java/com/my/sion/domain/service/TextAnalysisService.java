package com.my.sion.domain.service;

import com.my.sion.domain.model.AnalysisResult;
import com.my.sion.domain.model.Intent;
import com.my.sion.domain.model.IntentMatch;
import com.my.sion.domain.port.in.AnalyzeTextUseCase;
import com.my.sion.domain.port.out.IntentClassifier;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 왜: 의도 분류와 엔티티 추출을 같은 원문에 독립적으로 적용해 하나의 불변 결과로 묶기 위함.
 */
public class TextAnalysisService implements AnalyzeTextUseCase {

    private static final Map<String, String> SUPPORTED_INTENTS = Arrays.stream(Intent.values())
            .collect(Collectors.toMap(Intent::wireName, Intent::description, (a, b) -> a, LinkedHashMap::new));

    private final IntentClassifier intentClassifier;
    private final EntityExtractor entityExtractor;

    public TextAnalysisService(IntentClassifier intentClassifier, EntityExtractor entityExtractor) {
        this.intentClassifier = intentClassifier;
        this.entityExtractor = entityExtractor;
    }

    @Override
    public AnalysisResult analyze(String text) {
        String input = text == null ? "" : text;
        IntentMatch intent = intentClassifier.classify(input);
        return new AnalysisResult(input, intent, entityExtractor.extract(input));
    }

    @Override
    public Map<String, String> supportedIntents() {
        return Collections.unmodifiableMap(SUPPORTED_INTENTS);
    }
}
