package com.my.sion.domain.model;

/**
 * 왜: 추출 가능한 엔티티 종류를 고정해 후속 파서가 종류별로 안전하게 분기하도록 하기 위함.
 */
public enum EntityKind {
    TIME("time"),
    DATE("date"),
    DURATION("duration"),
    PERSON("person"),
    APP_NAME("app_name"),
    FILE_NAME("file_name");

    private final String wireName;

    EntityKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
