package com.my.sion.adapter.out.clock;

import com.my.sion.domain.port.out.ClockPort;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneId;

/**
 * 왜: 설정된 단일 시간대 기준의 현재 시각을 경계에서만 제공해 도메인이 시계를 직접 읽지 않게 하기 위함.
 */
public class OffsetClockAdapter implements ClockPort {

    private final Clock clock;

    private OffsetClockAdapter(Clock clock) {
        this.clock = clock;
    }

    public static OffsetClockAdapter system(ZoneId zoneId) {
        return new OffsetClockAdapter(Clock.system(zoneId));
    }

    public static OffsetClockAdapter fixed(Clock clock) {
        return new OffsetClockAdapter(clock);
    }

    @Override
    public OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
