package personal.bookly.core.tenant.adapter.in.web.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import personal.bookly.core.tenant.application.port.in.UpdateTenantHoursCommand;

import java.util.List;

/**
 * Update Tenant Hours Request DTO
 */
public record UpdateTenantHoursRequest(
        @NotEmpty(message = "hours cannot be empty")
        List<@Valid DayHoursRequest> hours
) {
    public UpdateTenantHoursCommand toCommand(String tenantSlug) {
        return new UpdateTenantHoursCommand(tenantSlug, hours.stream()
                .map(h -> new UpdateTenantHoursCommand.DayHours(
                        h.dayOfWeek(), h.openTime(), h.closeTime(), Boolean.TRUE.equals(h.closed())))
                .toList());
    }

    public record DayHoursRequest(
            @NotNull @Min(0) @Max(6) Integer dayOfWeek,
            String openTime,
            String closeTime,
            Boolean closed
    ) {
    }
}
