package com.my.sion.domain.service;

import com.my.sion.domain.model.ParsedDate;
import com.my.sion.domain.model.ParsedTime;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 왜: 사용자가 느슨하게 적은 날짜/시각 토큰을 확정 값으로 바꾸되, 해석에 실패해도 후속 로직이 쓸 수 있는 기본값을 돌려주기 위함.
 * 기본값을 썼는지는 {@link ParsedDate#defaulted()}, {@link ParsedTime#defaulted()}로 드러난다.
 */
public class DateTimeParser {

    private static final Pattern NEXT_WEEK = Pattern.compile("다음\\s*주|next\\s+week");
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    // 순서가 곧 우선순위다. 연도가 없는 형식은 기준일의 연도를 쓴다.
    private static final List<DateFormat> FORMATS = List.of(
            new DateFormat(Pattern.compile("(\\d{4})-(\\d{1,2})-(\\d{1,2})"),
                    (m, today) -> LocalDate.of(intOf(m, 1), intOf(m, 2), intOf(m, 3))),
            new DateFormat(Pattern.compile("(\\d{4})/(\\d{1,2})/(\\d{1,2})"),
                    (m, today) -> LocalDate.of(intOf(m, 1), intOf(m, 2), intOf(m, 3))),
            new DateFormat(Pattern.compile("(\\d{1,2})/(\\d{1,2})"),
                    (m, today) -> LocalDate.of(today.getYear(), intOf(m, 1), intOf(m, 2))),
            new DateFormat(Pattern.compile("(\\d{1,2})-(\\d{1,2})"),
                    (m, today) -> LocalDate.of(today.getYear(), intOf(m, 1), intOf(m, 2))),
            new DateFormat(Pattern.compile("(\\d{4})년\\s*(\\d{1,2})월\\s*(\\d{1,2})일"),
                    (m, today) -> LocalDate.of(intOf(m, 1), intOf(m, 2), intOf(m, 3))),
            new DateFormat(Pattern.compile("(\\d{1,2})월\\s*(\\d{1,2})일"),
                    (m, today) -> LocalDate.of(today.getYear(), intOf(m, 1), intOf(m, 2))),
            new DateFormat(Pattern.compile("(\\d{1,2})일"),
                    (m, today) -> LocalDate.of(today.getYear(), today.getMonthValue(), intOf(m, 1)))
    );

    public ParsedDate parseDate(String token, LocalDate today) {
        Objects.requireNonNull(today, "today");
        if (token == null || token.isBlank()) {
            return ParsedDate.fallback(today);
        }
        String normalized = token.trim().toLowerCase(Locale.ROOT);

        switch (normalized) {
            case "today", "오늘":
                return ParsedDate.parsed(today);
            case "tomorrow", "내일":
                return ParsedDate.parsed(today.plusDays(1));
            case "day after tomorrow", "모레":
                return ParsedDate.parsed(today.plusDays(2));
            case "yesterday", "어제":
                return ParsedDate.parsed(today.minusDays(1));
            default:
                break;
        }
        if (NEXT_WEEK.matcher(normalized).find()) {
            return ParsedDate.parsed(today.plusWeeks(1));
        }

        for (DateFormat format : FORMATS) {
            Matcher matcher = format.pattern().matcher(normalized);
            if (!matcher.matches()) {
                continue;
            }
            try {
                return ParsedDate.parsed(format.factory().apply(matcher, today));
            } catch (DateTimeException e) {
                // 형식은 맞지만 존재하지 않는 날짜(2/30 등): 다른 형식도 같은 숫자를 보므로 바로 기본값으로 간다.
                return ParsedDate.fallback(today);
            }
        }
        return ParsedDate.fallback(today);
    }

    /**
     * 첫 번째 숫자를 시, 두 번째 숫자를 분으로 본다. 오전/오후 보정은 정확히 한 번만 적용한다.
     */
    public ParsedTime parseTime(String token) {
        if (token == null || token.isBlank()) {
            return ParsedTime.DEFAULT;
        }
        String lower = token.toLowerCase(Locale.ROOT);
        boolean pm = lower.contains("오후") || lower.contains("pm");
        boolean am = lower.contains("오전") || lower.contains("am");

        List<Integer> numbers = new ArrayList<>();
        Matcher matcher = DIGITS.matcher(lower);
        while (matcher.find() && numbers.size() < 2) {
            numbers.add(parseIntOrNegative(matcher.group()));
        }
        if (numbers.isEmpty()) {
            return ParsedTime.DEFAULT;
        }

        int hour = numbers.get(0);
        int minute = numbers.size() > 1 ? numbers.get(1) : (lower.contains("반") ? 30 : 0);
        if (pm && hour < 12) {
            hour += 12;
        } else if (am && hour == 12) {
            hour = 0;
        }

        if (hour < 0 || hour > 23 || minute < 0 || minute > 59) {
            return ParsedTime.DEFAULT;
        }
        return new ParsedTime(hour, minute, false);
    }

    private static int intOf(Matcher matcher, int group) {
        return Integer.parseInt(matcher.group(group));
    }

    private static int parseIntOrNegative(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            // int 범위를 넘는 숫자열: 범위 검사에서 기본값으로 떨어진다.
            return -1;
        }
    }

    private record DateFormat(Pattern pattern, BiFunction<Matcher, LocalDate, LocalDate> factory) {
    }
}
