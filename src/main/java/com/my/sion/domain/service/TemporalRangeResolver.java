package com.my.sion.domain.service;

import com.my.sion.domain.exception.InvalidRequestException;
import com.my.sion.domain.model.DateRange;
import com.my.sion.domain.model.ParsedDate;
import com.my.sion.domain.model.PeriodQuery;
import com.my.sion.domain.model.RelativePeriod;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;
import java.util.Objects;

/**
 * 왜: "이번 주", "다음 달", "12월", 날짜 구간 같은 기간 질의를 기준일에 고정된 [시작, 종료] 날짜로 바꾸기 위함.
 *
 * <p>기준일(today)은 호출자가 넘기며 이 클래스는 시계를 읽지 않는다. 주는 월요일에 시작한다.
 */
public class TemporalRangeResolver {

    private static final DateTimeFormatter DAY_LABEL = DateTimeFormatter.ofPattern("yyyy년 M월 d일 (E)", Locale.KOREAN);
    private static final DateTimeFormatter FULL_DATE_LABEL = DateTimeFormatter.ofPattern("yyyy년 M월 d일", Locale.KOREAN);
    private static final DateTimeFormatter SHORT_DATE_LABEL = DateTimeFormatter.ofPattern("M월 d일", Locale.KOREAN);
    private static final DateTimeFormatter MONTH_LABEL = DateTimeFormatter.ofPattern("yyyy년 M월", Locale.KOREAN);
    // 라벨 형식(yyyy)이 표현하는 범위.
    private static final int MIN_YEAR = 1;
    private static final int MAX_YEAR = 9999;

    private final DateTimeParser dateTimeParser;

    public TemporalRangeResolver(DateTimeParser dateTimeParser) {
        this.dateTimeParser = Objects.requireNonNull(dateTimeParser, "dateTimeParser");
    }

    public DateRange resolve(PeriodQuery query, LocalDate today) {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(today, "today");
        if (query.periodType() == null) {
            return singleDay(today);
        }
        return switch (query.periodType()) {
            case DAY -> resolveDay(query, today);
            case WEEK -> resolveWeek(query.relative(), today);
            case MONTH -> resolveMonth(query, today);
            case RANGE -> resolveRange(query, today);
        };
    }

    private DateRange resolveDay(PeriodQuery query, LocalDate today) {
        if (isPresent(query.startDate())) {
            return singleDay(dateTimeParser.parseDate(query.startDate(), today).date());
        }
        LocalDate day = switch (query.relative()) {
            case TOMORROW, NEXT -> today.plusDays(1);
            case DAY_AFTER -> today.plusDays(2);
            case PREVIOUS -> today.minusDays(1);
            case TODAY, CURRENT, NONE -> today;
        };
        return singleDay(day);
    }

    private DateRange resolveWeek(RelativePeriod relative, LocalDate today) {
        LocalDate anchor = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        LocalDate start = anchor;
        String prefix = "이번 주";
        if (relative == RelativePeriod.NEXT) {
            start = anchor.plusWeeks(1);
            prefix = "다음 주";
        } else if (relative == RelativePeriod.PREVIOUS) {
            start = anchor.minusWeeks(1);
            prefix = "지난 주";
        }
        LocalDate end = start.plusDays(6);
        return new DateRange(start, end,
                prefix + " (" + start.format(SHORT_DATE_LABEL) + " ~ " + end.format(SHORT_DATE_LABEL) + ")");
    }

    private DateRange resolveMonth(PeriodQuery query, LocalDate today) {
        int year;
        int month;
        if (query.month() != null) {
            month = query.month();
            if (month < 1 || month > 12) {
                throw new InvalidRequestException("월은 1~12 사이여야 합니다: " + month);
            }
            year = query.year() != null ? query.year() : today.getYear();
            if (year < MIN_YEAR || year > MAX_YEAR) {
                throw new InvalidRequestException("연도는 " + MIN_YEAR + "~" + MAX_YEAR + " 사이여야 합니다: " + year);
            }
        } else {
            year = today.getYear();
            month = today.getMonthValue();
            if (query.relative() == RelativePeriod.NEXT) {
                if (month == 12) {
                    month = 1;
                    year += 1;
                } else {
                    month += 1;
                }
            } else if (query.relative() == RelativePeriod.PREVIOUS) {
                if (month == 1) {
                    month = 12;
                    year -= 1;
                } else {
                    month -= 1;
                }
            }
        }

        LocalDate start = LocalDate.of(year, month, 1);
        // 12월이면 다음 해 1월 1일에서 하루를 뺀다.
        LocalDate firstOfFollowing = month == 12 ? LocalDate.of(year + 1, 1, 1) : LocalDate.of(year, month + 1, 1);
        LocalDate end = firstOfFollowing.minusDays(1);
        return new DateRange(start, end, start.format(MONTH_LABEL));
    }

    private DateRange resolveRange(PeriodQuery query, LocalDate today) {
        if (!isPresent(query.startDate()) || !isPresent(query.endDate())) {
            return singleDay(today);
        }
        ParsedDate start = dateTimeParser.parseDate(query.startDate(), today);
        ParsedDate end = dateTimeParser.parseDate(query.endDate(), today);
        if (start.defaulted() || end.defaulted()) {
            return singleDay(today);
        }
        LocalDate from = start.date();
        LocalDate to = end.date();
        if (to.isBefore(from)) {
            LocalDate swap = from;
            from = to;
            to = swap;
        }
        return new DateRange(from, to, from.format(FULL_DATE_LABEL) + " ~ " + to.format(FULL_DATE_LABEL));
    }

    private static DateRange singleDay(LocalDate day) {
        return new DateRange(day, day, day.format(DAY_LABEL));
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
