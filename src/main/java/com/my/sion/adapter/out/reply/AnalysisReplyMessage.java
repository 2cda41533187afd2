package com.my.sion.adapter.out.reply;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.my.sion.domain.model.AnalysisReply;
import com.my.sion.domain.model.CalendarPlan;
import com.my.sion.domain.model.DateRange;
import com.my.sion.domain.model.Entity;
import com.my.sion.domain.model.EventSpec;
import com.my.sion.domain.model.EventUpdateSpec;
import com.my.sion.domain.model.TimeRange;

import java.time.ZoneId;
import java.util.List;

/**
 * 왜: 도메인 응답을 큐 소비자가 바로 쓸 수 있는 문자열 중심 JSON 구조로 고정하기 위함.
 * 날짜와 시각은 ISO-8601 문자열로 내보낸다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisReplyMessage(String requestId,
                                   String intent,
                                   double confidence,
                                   List<EntityMessage> entities,
                                   PlanMessage plan) {

    public static AnalysisReplyMessage from(AnalysisReply reply, ZoneId zoneId) {
        return new AnalysisReplyMessage(
                reply.requestId(),
                reply.result().intent().intent().wireName(),
                reply.result().intent().confidence(),
                reply.result().entities().stream().map(EntityMessage::from).toList(),
                reply.plan() == null ? null : PlanMessage.from(reply.plan(), zoneId)
        );
    }

    public record EntityMessage(String type, String value, int start, int end) {
        static EntityMessage from(Entity entity) {
            return new EntityMessage(entity.type().wireName(), entity.value(), entity.start(), entity.end());
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record PlanMessage(String action,
                              RangeMessage range,
                              EventMessage event,
                              String searchQuery,
                              UpdateMessage update) {
        static PlanMessage from(CalendarPlan plan, ZoneId zoneId) {
            return new PlanMessage(
                    plan.intent().wireName(),
                    plan.range() == null ? null : RangeMessage.from(plan.range(), zoneId),
                    plan.event() == null ? null : EventMessage.from(plan.event(), zoneId),
                    plan.searchQuery(),
                    plan.update() == null ? null : UpdateMessage.from(plan.update(), zoneId)
            );
        }
    }

    public record RangeMessage(String start, String end, String label, String timeMin, String timeMax) {
        static RangeMessage from(DateRange range, ZoneId zoneId) {
            TimeRange window = range.toTimeWindow(zoneId);
            return new RangeMessage(
                    range.start().toString(),
                    range.end().toString(),
                    range.label(),
                    window.start().toString(),
                    window.end().toString()
            );
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record EventMessage(String title,
                               String start,
                               String end,
                               boolean allDay,
                               String timeZone,
                               String recurrence) {
        static EventMessage from(EventSpec event, ZoneId zoneId) {
            // 종일 일정은 날짜만, 시간 일정은 로컬 시각을 보낸다.
            String start = event.allDay() ? event.startDate().toString() : event.start().toString();
            String end = event.allDay() ? event.endDate().toString() : event.end().toString();
            return new EventMessage(
                    event.title(),
                    start,
                    end,
                    event.allDay(),
                    zoneId.getId(),
                    event.isRecurring() ? event.recurrence().toRRule() : null
            );
        }
    }

    /**
     * 바뀌지 않는 필드는 생략된다. 일정 시각이 바뀌지 않으면 timeZone도 없다.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record UpdateMessage(String searchQuery, String title, String start, String end, String timeZone) {
        static UpdateMessage from(EventUpdateSpec update, ZoneId zoneId) {
            boolean rescheduled = update.start() != null;
            return new UpdateMessage(
                    update.searchQuery(),
                    update.title(),
                    rescheduled ? update.start().toString() : null,
                    rescheduled ? update.end().toString() : null,
                    rescheduled ? zoneId.getId() : null
            );
        }
    }
}
