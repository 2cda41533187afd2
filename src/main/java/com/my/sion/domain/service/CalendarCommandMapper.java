package com.my.sion.domain.service;

import com.my.sion.domain.model.AnalysisResult;
import com.my.sion.domain.model.EntityKind;
import com.my.sion.domain.model.EventRequest;
import com.my.sion.domain.model.PeriodQuery;
import com.my.sion.domain.model.RelativePeriod;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 왜: 자유 텍스트 분석 결과를 구조화된 기간 질의/일정 요청으로 옮겨, 도구 호출 페이로드와 같은 경로로 해석되게 하기 위함.
 * 종류별 첫 번째 엔티티를 대표값으로 쓴다.
 */
public class CalendarCommandMapper {

    private static final Pattern WEEK = Pattern.compile("(이번|다음|지난)\\s*주");
    private static final Pattern MONTH_RELATIVE = Pattern.compile("(이번|다음|지난)\\s*달");
    private static final Pattern MONTH_ONLY = Pattern.compile("(\\d{1,2})월");
    private static final Pattern DURATION = Pattern.compile("(\\d+)\\s*(분|시간|초)");
    private static final List<String> TITLE_KEYWORDS = List.of("회의", "미팅", "약속");

    public PeriodQuery toPeriodQuery(AnalysisResult result) {
        Optional<String> date = result.firstValue(EntityKind.DATE);
        if (date.isEmpty()) {
            return PeriodQuery.day(RelativePeriod.TODAY);
        }
        String value = date.get().trim();

        Matcher week = WEEK.matcher(value);
        if (week.matches()) {
            return PeriodQuery.week(RelativePeriod.fromKeyword(week.group(1)));
        }
        Matcher monthRelative = MONTH_RELATIVE.matcher(value);
        if (monthRelative.matches()) {
            return PeriodQuery.month(RelativePeriod.fromKeyword(monthRelative.group(1)));
        }
        Matcher monthOnly = MONTH_ONLY.matcher(value);
        if (monthOnly.matches()) {
            int month = Integer.parseInt(monthOnly.group(1));
            if (month >= 1 && month <= 12) {
                return PeriodQuery.monthOf(null, month);
            }
            return PeriodQuery.day(RelativePeriod.TODAY);
        }
        return PeriodQuery.dayOf(value);
    }

    public EventRequest toEventRequest(AnalysisResult result) {
        return new EventRequest(
                titleOf(result.text()),
                result.firstValue(EntityKind.DATE).orElse(null),
                null,
                result.firstValue(EntityKind.TIME).orElse(null),
                result.firstValue(EntityKind.DURATION).map(CalendarCommandMapper::toMinutes).orElse(null),
                false,
                null
        );
    }

    /**
     * 일정 검색어: 텍스트에 들어 있는 첫 제목 키워드. 없으면 빈 문자열(전체 대상).
     */
    public String searchQueryOf(AnalysisResult result) {
        return TITLE_KEYWORDS.stream()
                .filter(result.text()::contains)
                .findFirst()
                .orElse("");
    }

    static String titleOf(String text) {
        return TITLE_KEYWORDS.stream()
                .filter(text::contains)
                .findFirst()
                .orElse(EventSpecBuilder.DEFAULT_TITLE);
    }

    static Integer toMinutes(String duration) {
        Matcher matcher = DURATION.matcher(duration);
        if (!matcher.find()) {
            return null;
        }
        long amount;
        try {
            amount = Long.parseLong(matcher.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
        long minutes = switch (matcher.group(2)) {
            case "시간" -> amount * 60;
            case "분" -> amount;
            default -> amount / 60;
        };
        if (minutes <= 0 || minutes > Integer.MAX_VALUE) {
            return null;
        }
        return (int) minutes;
    }
}
