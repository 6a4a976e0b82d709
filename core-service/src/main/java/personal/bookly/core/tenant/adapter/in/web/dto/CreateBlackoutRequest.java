package personal.bookly.core.tenant.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import personal.bookly.core.tenant.application.port.in.CreateBlackoutCommand;

import java.time.OffsetDateTime;

/**
 * Create Blackout Request DTO
 */
public record CreateBlackoutRequest(
        Long resourceId,
        Long staffId,
        Long serviceId,
        @NotNull(message = "startsAt is required") OffsetDateTime startsAt,
        @NotNull(message = "endsAt is required") OffsetDateTime endsAt,
        @Size(max = 255) String reason
) {
    public CreateBlackoutCommand toCommand(String tenantSlug) {
        return new CreateBlackoutCommand(tenantSlug, resourceId, staffId, serviceId,
                startsAt.toInstant(), endsAt.toInstant(), reason);
    }
}
