package com.my.sion.domain.port.out;

import java.time.OffsetDateTime;

/**
 * 왜: 현재 시각을 주입형으로 분리해 기간 해석이 시계 없이도 결정적으로 테스트되도록 하기 위함.
 */
public interface ClockPort {
    OffsetDateTime now();
}
