package com.my.sion.domain.rule;

import com.my.sion.domain.model.Intent;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 왜: 의도 규칙을 기동 시 한 번 만들고 이후 변경하지 않아 동시 분류에서도 잠금 없이 공유하기 위함.
 * 규칙 순서가 동점 처리 기준이므로 목록 순서를 그대로 유지한다.
 */
public final class IntentRuleTable {

    private final List<IntentRule> rules;

    public IntentRuleTable(List<IntentRule> rules) {
        Objects.requireNonNull(rules, "rules");
        Set<Intent> seen = new LinkedHashSet<>();
        for (IntentRule rule : rules) {
            if (!seen.add(rule.intent())) {
                throw new IllegalArgumentException("의도 규칙이 중복되었습니다: " + rule.intent().wireName());
            }
            if (rule.intent() == Intent.LLM_CHAT || rule.intent() == Intent.UNKNOWN) {
                throw new IllegalArgumentException("폴백 전용 의도에는 규칙을 둘 수 없습니다: " + rule.intent().wireName());
            }
        }
        this.rules = List.copyOf(rules);
    }

    public List<IntentRule> rules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    public static IntentRuleTable defaults() {
        return new IntentRuleTable(List.of(
                IntentRule.of(Intent.SCHEDULE_CHECK, "일정", "스케줄", "약속", "오늘\\s*뭐", "언제"),
                IntentRule.of(Intent.SCHEDULE_ADD,
                        "일정\\s*(추가|등록|잡아|넣어)",
                        "(회의|미팅|약속)\\s*(잡아|만들어|추가|등록)"),
                IntentRule.of(Intent.SCHEDULE_DELETE, "일정\\s*(삭제|취소)", "(약속|회의|미팅)\\s*(취소|삭제)"),
                IntentRule.of(Intent.SCHEDULE_UPDATE,
                        "일정\\s*(수정|변경|바꿔|옮겨)",
                        "(회의|미팅|약속)\\s*(시간)?\\s*(변경|바꿔|옮겨|미뤄)",
                        "(으로|로)\\s*(변경|바꿔|옮겨|미뤄)"),
                IntentRule.of(Intent.EMAIL_CHECK, "이메일\\s*(확인|읽어)", "메일\\s*(확인|읽어)", "새\\s*메일"),
                IntentRule.of(Intent.EMAIL_SEND, "이메일\\s*(보내|전송)", "메일\\s*(보내|전송)"),
                IntentRule.of(Intent.FILE_SEARCH, "파일\\s*(찾아|검색)", "어디.*있", "폴더"),
                IntentRule.of(Intent.FILE_OPEN, "파일\\s*(열어|실행)", "문서\\s*열어"),
                IntentRule.of(Intent.APP_OPEN, "(실행|열어|켜).*(앱|프로그램|어플)", "(크롬|브라우저|메모장|계산기)"),
                IntentRule.of(Intent.WEB_SEARCH, "검색", "(인터넷|웹|구글|네이버)", "찾아\\s*봐"),
                IntentRule.of(Intent.WEATHER_CHECK, "날씨", "기온", "비\\s*올까"),
                IntentRule.of(Intent.TIMER_SET, "타이머", "알람", "분\\s*후"),
                IntentRule.of(Intent.REMINDER_SET, "리마인더", "알림", "까먹지"),
                IntentRule.of(Intent.SYSTEM_CONTROL, "볼륨", "음량", "밝기", "종료", "재부팅")
        ));
    }
}
