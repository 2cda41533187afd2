package com.my.sion.domain.port.in;

import com.my.sion.domain.model.AnalysisResult;
import com.my.sion.domain.model.CalendarCommand;
import com.my.sion.domain.model.CalendarPlan;
import com.my.sion.domain.model.DateRange;
import com.my.sion.domain.model.EventRequest;
import com.my.sion.domain.model.EventSpec;
import com.my.sion.domain.model.EventUpdateRequest;
import com.my.sion.domain.model.EventUpdateSpec;
import com.my.sion.domain.model.PeriodQuery;
import com.my.sion.domain.model.RecurrenceSpec;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * 왜: 캘린더 조회/등록/수정 협력자가 필요로 하는 확정 값을 부수 효과 없이 계산하는 진입점을 제공하기 위함.
 * 모든 연산은 호출자가 넘긴 now를 기준으로 하며 시계를 직접 읽지 않는다.
 */
public interface PlanCalendarUseCase {

    DateRange resolveRange(PeriodQuery query, OffsetDateTime now);

    EventSpec buildEvent(EventRequest request, OffsetDateTime now);

    Optional<RecurrenceSpec> buildRecurrence(String frequencyKeyword, Integer count);

    EventUpdateSpec buildUpdate(EventUpdateRequest request,
                                LocalDateTime currentStart,
                                LocalDateTime currentEnd,
                                OffsetDateTime now);

    /**
     * 일정 의도가 아니면 empty.
     */
    Optional<CalendarPlan> plan(AnalysisResult result, OffsetDateTime now);

    /**
     * 구조화된 명령은 텍스트 의도와 무관하게 명령 종류대로 계획한다.
     */
    CalendarPlan planCommand(CalendarCommand command, OffsetDateTime now);
}
