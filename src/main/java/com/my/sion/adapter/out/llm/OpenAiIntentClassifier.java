package com.my.sion.adapter.out.llm;

import com.my.sion.adapter.out.rules.RuleTableLoader;
import com.my.sion.config.AppConfig;
import com.my.sion.domain.exception.IntentParseException;
import com.my.sion.domain.model.Intent;
import com.my.sion.domain.model.IntentMatch;
import com.my.sion.domain.port.out.IntentClassifier;
import com.my.sion.domain.service.RuleBasedIntentClassifier;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.service.AiServices;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.faulttolerance.Fallback;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.jboss.logging.Logger;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * 왜: 규칙 테이블로 잡히지 않는 표현을 LLM 라벨링으로 보완하되, 호출이 실패하면 규칙 분류기로 되돌아가 항상 결과를 내기 위함.
 * 신뢰도는 규칙 분류기와 같은 [0.3, 0.9] 구간으로 맞춘다.
 */
@IfBuildProperty(name = "app.nlu.classifier", stringValue = "openai")
@ApplicationScoped
public class OpenAiIntentClassifier implements IntentClassifier {

    private static final Logger log = Logger.getLogger(OpenAiIntentClassifier.class);

    static final double MIN_CONFIDENCE = 0.3;
    static final double MAX_CONFIDENCE = 0.9;
    static final double MISSING_CONFIDENCE = 0.6;

    private static final String LABELS = Arrays.stream(Intent.values())
            .map(intent -> intent.wireName() + " (" + intent.description() + ")")
            .collect(Collectors.joining(", "));

    private final IntentLabeler intentLabeler;
    private final RuleBasedIntentClassifier fallbackClassifier;

    @Inject
    public OpenAiIntentClassifier(AppConfig appConfig, RuleTableLoader ruleTableLoader) {
        this(buildLabeler(appConfig), new RuleBasedIntentClassifier(ruleTableLoader.intentRuleTable()));
    }

    OpenAiIntentClassifier(IntentLabeler intentLabeler, RuleBasedIntentClassifier fallbackClassifier) {
        this.intentLabeler = intentLabeler;
        this.fallbackClassifier = fallbackClassifier;
    }

    @Override
    @Retry(maxRetries = 2, delay = 500, abortOn = IntentParseException.class)
    @Fallback(fallbackMethod = "classifyWithRules")
    public IntentMatch classify(String text) {
        String input = text == null ? "" : text;
        if (input.isBlank()) {
            return fallbackClassifier.classify(input);
        }
        LabelResponse response = intentLabeler.label(input, LABELS);
        if (response == null || response.intent() == null) {
            throw new IntentParseException("LLM 의도 응답이 비어 있습니다.");
        }
        Intent intent = Intent.fromWireName(response.intent())
                .orElseThrow(() -> new IntentParseException("알 수 없는 의도 라벨: " + response.intent()));
        return new IntentMatch(intent, clamp(response.confidence()));
    }

    IntentMatch classifyWithRules(String text) {
        log.warn("LLM 의도 분류 실패, 규칙 분류기로 대체합니다.");
        return fallbackClassifier.classify(text);
    }

    static double clamp(Double confidence) {
        if (confidence == null || confidence.isNaN()) {
            return MISSING_CONFIDENCE;
        }
        return Math.max(MIN_CONFIDENCE, Math.min(MAX_CONFIDENCE, confidence));
    }

    private static IntentLabeler buildLabeler(AppConfig appConfig) {
        OpenAiChatModel model = OpenAiChatModel.builder()
                .apiKey(appConfig.openai().apiKey().orElse(""))
                .modelName(appConfig.openai().model())
                .temperature(appConfig.openai().temperature())
                .build();
        return AiServices.builder(IntentLabeler.class)
                .chatLanguageModel(model)
                .build();
    }

    interface IntentLabeler {
        @SystemMessage("사용자 발화를 다음 의도 중 하나로 분류하세요: {{labels}}. "
                + "intent에는 괄호 앞의 영문 라벨만, confidence에는 0과 1 사이의 확신도를 넣어 JSON으로 반환하세요.")
        LabelResponse label(@UserMessage String text, @V("labels") String labels);
    }

    public record LabelResponse(String intent, Double confidence) {}
}
