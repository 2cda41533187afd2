package com.my.sion.domain.service;

import com.my.sion.domain.model.Intent;
import com.my.sion.domain.model.IntentMatch;
import com.my.sion.domain.port.out.IntentClassifier;
import com.my.sion.domain.rule.IntentRule;
import com.my.sion.domain.rule.IntentRuleTable;

import java.util.Locale;
import java.util.Objects;

/**
 * 왜: 키워드 패턴 적중률로 의도를 고르는 기본 분류기. 학습 모델이 없어도 항상 결과를 내도록 하기 위함.
 *
 * <p>점수는 (적중 패턴 수 / 전체 패턴 수)이며 엄격히 더 큰 점수만 교체하므로 동점이면 테이블에서 먼저 나온 의도가 이긴다.
 * 최종 신뢰도는 {@code 0.3 + score * 0.6}으로 보정되어 항상 [0.3, 0.9] 안에 있다.
 */
public class RuleBasedIntentClassifier implements IntentClassifier {

    static final double CONFIDENCE_FLOOR = 0.3;
    static final double CONFIDENCE_SPAN = 0.6;
    static final double CHAT_FALLBACK_SCORE = 0.5;
    static final int CHAT_FALLBACK_MIN_LENGTH = 5;

    private final IntentRuleTable ruleTable;

    public RuleBasedIntentClassifier(IntentRuleTable ruleTable) {
        this.ruleTable = Objects.requireNonNull(ruleTable, "ruleTable");
    }

    @Override
    public IntentMatch classify(String text) {
        String raw = text == null ? "" : text;
        String normalized = raw.toLowerCase(Locale.ROOT);

        Intent bestIntent = Intent.UNKNOWN;
        double bestScore = 0.0;
        for (IntentRule rule : ruleTable.rules()) {
            double score = rule.score(normalized);
            if (score > bestScore) {
                bestScore = score;
                bestIntent = rule.intent();
            }
        }

        if (bestIntent == Intent.UNKNOWN && raw.codePointCount(0, raw.length()) > CHAT_FALLBACK_MIN_LENGTH) {
            bestIntent = Intent.LLM_CHAT;
            bestScore = CHAT_FALLBACK_SCORE;
        }
        return new IntentMatch(bestIntent, calibrate(bestScore));
    }

    static double calibrate(double score) {
        return CONFIDENCE_FLOOR + score * CONFIDENCE_SPAN;
    }
}
