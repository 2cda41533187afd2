package com.my.sion.domain.model;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Objects;

/**
 * 왜: 기간 해석 결과를 시작일/종료일(포함)과 사람이 읽는 라벨로 고정해 조회 요청 생성에 그대로 쓰기 위함.
 */
public record DateRange(LocalDate start, LocalDate end, String label) {
    public DateRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(label, "label");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("종료일이 시작일보다 이를 수 없습니다: " + start + " ~ " + end);
        }
    }

    public boolean isSingleDay() {
        return start.equals(end);
    }

    /**
     * 제공자 목록 조회용 창: timeMin = 시작일 자정, timeMax = 종료일 다음 날 자정(배타).
     */
    public TimeRange toTimeWindow(ZoneId zoneId) {
        return new TimeRange(
                start.atStartOfDay(zoneId).toOffsetDateTime(),
                end.plusDays(1).atStartOfDay(zoneId).toOffsetDateTime()
        );
    }
}
