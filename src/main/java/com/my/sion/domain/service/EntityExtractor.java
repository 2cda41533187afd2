package com.my.sion.domain.service;

import com.my.sion.domain.model.Entity;
import com.my.sion.domain.rule.EntityPatternTable;
import com.my.sion.domain.rule.EntityRule;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 왜: 원문에서 시간/날짜/기간/사람/앱/파일 구간을 패턴 순서대로 뽑아 하위 해석기가 대표값을 고를 수 있게 하기 위함.
 * 종류 간 중복 구간은 제거하지 않는다.
 */
public class EntityExtractor {

    private final EntityPatternTable patternTable;

    public EntityExtractor(EntityPatternTable patternTable) {
        this.patternTable = Objects.requireNonNull(patternTable, "patternTable");
    }

    public List<Entity> extract(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<Entity> entities = new ArrayList<>();
        for (EntityRule rule : patternTable.rules()) {
            for (Pattern pattern : rule.patterns()) {
                Matcher matcher = pattern.matcher(text);
                while (matcher.find()) {
                    // 빈 매치는 구간 계약(start < end)을 어기므로 건너뛴다.
                    if (matcher.end() > matcher.start()) {
                        entities.add(new Entity(rule.kind(), matcher.group(), matcher.start(), matcher.end()));
                    }
                }
            }
        }
        return List.copyOf(entities);
    }
}
