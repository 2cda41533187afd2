package com.my.sion.domain.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * 왜: 라우팅 계층이 의도 이름으로 작업 핸들러를 고르므로, 의도 집합을 닫힌 열거형으로 고정해 오타나 임의 값 유입을 막기 위함.
 */
public enum Intent {
    SCHEDULE_CHECK("schedule_check", "일정 확인"),
    SCHEDULE_ADD("schedule_add", "일정 추가"),
    SCHEDULE_DELETE("schedule_delete", "일정 삭제"),
    SCHEDULE_UPDATE("schedule_update", "일정 수정"),
    EMAIL_CHECK("email_check", "이메일 확인"),
    EMAIL_SEND("email_send", "이메일 전송"),
    FILE_SEARCH("file_search", "파일 검색"),
    FILE_OPEN("file_open", "파일 열기"),
    APP_OPEN("app_open", "앱 실행"),
    WEB_SEARCH("web_search", "웹 검색"),
    WEATHER_CHECK("weather_check", "날씨 확인"),
    TIMER_SET("timer_set", "타이머 설정"),
    REMINDER_SET("reminder_set", "리마인더 설정"),
    LLM_CHAT("llm_chat", "일반 대화/질문"),
    SYSTEM_CONTROL("system_control", "시스템 제어"),
    UNKNOWN("unknown", "알 수 없음");

    private final String wireName;
    private final String description;

    Intent(String wireName, String description) {
        this.wireName = wireName;
        this.description = description;
    }

    public String wireName() {
        return wireName;
    }

    public String description() {
        return description;
    }

    public boolean isCalendar() {
        return this == SCHEDULE_CHECK || this == SCHEDULE_ADD || this == SCHEDULE_DELETE || this == SCHEDULE_UPDATE;
    }

    public static Optional<Intent> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(intent -> intent.wireName.equals(normalized))
                .findFirst();
    }
}
