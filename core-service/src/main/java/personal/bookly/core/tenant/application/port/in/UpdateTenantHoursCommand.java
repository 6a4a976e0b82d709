package personal.bookly.core.tenant.application.port.in;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;

import java.util.List;

/**
 * Update Tenant Hours Command
 * 요일별 영업시간 일괄 반영 (전달된 요일만 upsert)
 */
public record UpdateTenantHoursCommand(
        String tenantSlug,
        List<DayHours> days
) {
    public UpdateTenantHoursCommand {
        if (tenantSlug == null || tenantSlug.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Tenant cannot be blank");
        }
        if (days == null || days.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "At least one day is required");
        }
        long distinct = days.stream().map(DayHours::dayOfWeek).distinct().count();
        if (distinct != days.size()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Duplicate day of week in request");
        }
        days = List.copyOf(days);
    }

    /**
     * @param openTime  "HH:MM" 또는 "h:mm am/pm"
     * @param closeTime "HH:MM" 또는 "h:mm am/pm" (open 이하이면 자정 넘김)
     */
    public record DayHours(int dayOfWeek, String openTime, String closeTime, boolean closed) {
        public DayHours {
            if (dayOfWeek < 0 || dayOfWeek > 6) {
                throw new BusinessException(ErrorCode.INVALID_INPUT, "Day of week must be between 0 and 6: " + dayOfWeek);
            }
            if (!closed && (openTime == null || openTime.isBlank() || closeTime == null || closeTime.isBlank())) {
                throw new BusinessException(ErrorCode.INVALID_INPUT, "Open and close time are required when not closed");
            }
        }
    }
}
