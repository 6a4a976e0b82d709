package personal.bookly.core.schedule.domain.model;

import personal.bookly.common.time.TimeWindow;

import java.util.List;

/**
 * 스태프 일정 해석 결과
 * UNSUPPORTED는 "근무 없음"(RESOLVED + 빈 블록)과 구분되며, 호출 측은 영업시간으로 대체한다
 */
public record ScheduleResolution(Status status, List<TimeWindow> blocks) {

    public enum Status {
        RESOLVED,
        UNSUPPORTED
    }

    public ScheduleResolution {
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
    }

    public static ScheduleResolution resolved(List<TimeWindow> blocks) {
        return new ScheduleResolution(Status.RESOLVED, blocks);
    }

    public static ScheduleResolution unsupported() {
        return new ScheduleResolution(Status.UNSUPPORTED, List.of());
    }

    public boolean isUnsupported() {
        return status == Status.UNSUPPORTED;
    }
}
