package com.my.sion.adapter.out.rules;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.sion.config.AppConfig;
import com.my.sion.domain.exception.RuleTableLoadException;
import com.my.sion.domain.model.EntityKind;
import com.my.sion.domain.model.Intent;
import com.my.sion.domain.rule.EntityPatternTable;
import com.my.sion.domain.rule.EntityRule;
import com.my.sion.domain.rule.IntentRule;
import com.my.sion.domain.rule.IntentRuleTable;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * 왜: 규칙 테이블을 기동 시 한 번만 읽어 불변 테이블로 고정하기 위함. 경로가 없으면 내장 기본 테이블을 쓴다.
 * 경로는 파일 시스템 경로이거나 {@code classpath:} 접두사가 붙은 리소스 이름이다.
 */
@ApplicationScoped
public class RuleTableLoader {

    private static final Logger log = Logger.getLogger(RuleTableLoader.class);
    static final String CLASSPATH_PREFIX = "classpath:";

    private final IntentRuleTable intentRuleTable;
    private final EntityPatternTable entityPatternTable;

    @Inject
    public RuleTableLoader(AppConfig appConfig, ObjectMapper objectMapper) {
        this(appConfig.nlu().rulesPath(), objectMapper);
    }

    RuleTableLoader(Optional<String> rulesPath, ObjectMapper objectMapper) {
        Optional<RuleTableDocument> document = rulesPath
                .filter(path -> !path.isBlank())
                .map(path -> read(path, objectMapper));
        this.intentRuleTable = document
                .map(RuleTableDocument::intents)
                .filter(entries -> !entries.isEmpty())
                .map(RuleTableLoader::toIntentTable)
                .orElseGet(IntentRuleTable::defaults);
        this.entityPatternTable = document
                .map(RuleTableDocument::entities)
                .filter(entries -> !entries.isEmpty())
                .map(RuleTableLoader::toEntityTable)
                .orElseGet(EntityPatternTable::defaults);
        log.infof("규칙 테이블 적재 완료: intents=%d, entityKinds=%d, source=%s",
                intentRuleTable.size(), entityPatternTable.size(), rulesPath.orElse("builtin"));
    }

    public IntentRuleTable intentRuleTable() {
        return intentRuleTable;
    }

    public EntityPatternTable entityPatternTable() {
        return entityPatternTable;
    }

    private static RuleTableDocument read(String location, ObjectMapper objectMapper) {
        try (InputStream in = open(location)) {
            RuleTableDocument document = objectMapper.readValue(in, RuleTableDocument.class);
            if (document == null) {
                throw new RuleTableLoadException("규칙 파일이 비어 있습니다: " + location);
            }
            return document;
        } catch (IOException e) {
            throw new RuleTableLoadException("규칙 파일을 읽지 못했습니다: " + location, e);
        }
    }

    private static InputStream open(String location) throws IOException {
        if (location.startsWith(CLASSPATH_PREFIX)) {
            String resource = location.substring(CLASSPATH_PREFIX.length());
            InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(resource);
            if (in == null) {
                throw new RuleTableLoadException("규칙 리소스가 없습니다: " + location);
            }
            return in;
        }
        return Files.newInputStream(Path.of(location));
    }

    private static IntentRuleTable toIntentTable(List<RuleTableDocument.IntentRuleEntry> entries) {
        try {
            return new IntentRuleTable(entries.stream()
                    .map(entry -> IntentRule.of(
                            Intent.fromWireName(entry.intent())
                                    .orElseThrow(() -> new RuleTableLoadException("알 수 없는 의도: " + entry.intent())),
                            patternsOf(entry.patterns(), entry.intent())))
                    .toList());
        } catch (IllegalArgumentException e) {
            throw new RuleTableLoadException("의도 규칙이 올바르지 않습니다: " + e.getMessage(), e);
        }
    }

    private static EntityPatternTable toEntityTable(List<RuleTableDocument.EntityRuleEntry> entries) {
        try {
            return new EntityPatternTable(entries.stream()
                    .map(entry -> EntityRule.of(kindOf(entry.kind()), patternsOf(entry.patterns(), entry.kind())))
                    .toList());
        } catch (IllegalArgumentException e) {
            throw new RuleTableLoadException("엔티티 규칙이 올바르지 않습니다: " + e.getMessage(), e);
        }
    }

    private static EntityKind kindOf(String name) {
        return Arrays.stream(EntityKind.values())
                .filter(kind -> kind.wireName().equals(name))
                .findFirst()
                .orElseThrow(() -> new RuleTableLoadException("알 수 없는 엔티티 종류: " + name));
    }

    private static List<String> patternsOf(List<String> patterns, String owner) {
        if (patterns == null || patterns.isEmpty()) {
            throw new RuleTableLoadException("패턴이 비어 있습니다: " + owner);
        }
        return patterns;
    }
}
