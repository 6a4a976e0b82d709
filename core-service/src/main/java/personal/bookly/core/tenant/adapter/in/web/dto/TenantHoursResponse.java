package personal.bookly.core.tenant.adapter.in.web.dto;

import personal.bookly.common.time.SlotMath;
import personal.bookly.core.tenant.domain.model.TenantHours;

/**
 * Tenant Hours Response DTO
 */
public record TenantHoursResponse(
        int dayOfWeek,
        String openTime,
        String closeTime,
        boolean closed
) {
    public static TenantHoursResponse from(TenantHours hours) {
        return new TenantHoursResponse(
                hours.dayOfWeek(),
                hours.openTime() == null ? null : SlotMath.formatClockTime(SlotMath.toMinutes(hours.openTime())),
                hours.closeTime() == null ? null : SlotMath.formatClockTime(SlotMath.toMinutes(hours.closeTime())),
                hours.closed()
        );
    }
}
