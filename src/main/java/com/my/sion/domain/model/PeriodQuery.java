package com.my.sion.domain.model;

/**
 * 왜: 자유 텍스트나 도구 호출 페이로드에서 온 기간 요청을 구조화해 해석기가 한 번에 소비하도록 하기 위함.
 * 날짜 필드는 원시 토큰이며 해석 시점에 파싱된다.
 */
public record PeriodQuery(
        PeriodType periodType,
        RelativePeriod relative,
        Integer year,
        Integer month,
        String startDate,
        String endDate
) {
    public PeriodQuery {
        relative = relative == null ? RelativePeriod.NONE : relative;
    }

    public static PeriodQuery day(RelativePeriod relative) {
        return new PeriodQuery(PeriodType.DAY, relative, null, null, null, null);
    }

    public static PeriodQuery dayOf(String date) {
        return new PeriodQuery(PeriodType.DAY, RelativePeriod.NONE, null, null, date, null);
    }

    public static PeriodQuery week(RelativePeriod relative) {
        return new PeriodQuery(PeriodType.WEEK, relative, null, null, null, null);
    }

    public static PeriodQuery month(RelativePeriod relative) {
        return new PeriodQuery(PeriodType.MONTH, relative, null, null, null, null);
    }

    public static PeriodQuery monthOf(Integer year, int month) {
        return new PeriodQuery(PeriodType.MONTH, RelativePeriod.NONE, year, month, null, null);
    }

    public static PeriodQuery range(String startDate, String endDate) {
        return new PeriodQuery(PeriodType.RANGE, RelativePeriod.NONE, null, null, startDate, endDate);
    }
}
