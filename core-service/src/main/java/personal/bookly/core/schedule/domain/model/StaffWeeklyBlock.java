package personal.bookly.core.schedule.domain.model;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;
import personal.bookly.common.time.TimeWindow;

/**
 * Staff Weekly Block
 * 요일별 근무 블록 (weekday 0=일요일 .. 6=토요일)
 */
public record StaffWeeklyBlock(
        Long id,
        Long tenantId,
        Long staffId,
        int weekday,
        int startMinute,
        int endMinute) {
    public StaffWeeklyBlock {
        if (weekday < 0 || weekday > 6) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Weekday must be between 0 and 6: " + weekday);
        }
        ScheduleMinutes.validate(startMinute, endMinute);
    }

    public TimeWindow window() {
        return TimeWindow.of(startMinute, endMinute);
    }
}
