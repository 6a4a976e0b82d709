package personal.bookly.core.schedule.domain.model;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;
import personal.bookly.common.time.TimeWindow;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * Staff Schedule Override
 * 특정 날짜의 스태프 일정 예외
 * OFF는 시간 필드가 없어야 하고 나머지 유형은 시간 필드가 필수
 */
public record StaffScheduleOverride(
        Long id,
        Long tenantId,
        Long staffId,
        LocalDate date,
        OverrideType type,
        Integer startMinute,
        Integer endMinute) {
    public StaffScheduleOverride {
        if (date == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Override date is required");
        }
        if (type == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Override type is required");
        }
        if (type.carriesHours()) {
            ScheduleMinutes.validate(startMinute, endMinute);
        } else if (startMinute != null || endMinute != null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "OFF overrides must not include time fields");
        }
    }

    public Optional<TimeWindow> window() {
        if (!type.carriesHours()) {
            return Optional.empty();
        }
        return Optional.of(TimeWindow.of(startMinute, endMinute));
    }

    public boolean isSameAs(StaffScheduleOverride other) {
        return date.equals(other.date)
                && type == other.type
                && Objects.equals(startMinute, other.startMinute)
                && Objects.equals(endMinute, other.endMinute);
    }
}
