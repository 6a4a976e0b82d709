package personal.bookly.core.schedule.domain.model;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;
import personal.bookly.common.time.SlotMath;

/**
 * 스태프 일정 블록의 분 단위 범위 검증
 * start: 0..1439, end: 1..1440, end > start (같은 날 안에서만)
 */
final class ScheduleMinutes {

    private ScheduleMinutes() {
    }

    static void validate(Integer startMinute, Integer endMinute) {
        if (startMinute == null || endMinute == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Start and end minute are required");
        }
        if (startMinute < 0 || startMinute >= SlotMath.MINUTES_PER_DAY) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Start minute out of range: " + startMinute);
        }
        if (endMinute < 1 || endMinute > SlotMath.MINUTES_PER_DAY) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "End minute out of range: " + endMinute);
        }
        if (endMinute <= startMinute) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "End minute must be after start minute");
        }
    }
}
