package personal.bookly.core.tenant.adapter.in.web.dto;

import personal.bookly.core.tenant.domain.model.Blackout;

import java.time.Instant;

/**
 * Blackout Response DTO
 */
public record BlackoutResponse(
        Long id,
        Long resourceId,
        Long staffId,
        Long serviceId,
        Instant startsAt,
        Instant endsAt,
        String reason,
        boolean active
) {
    public static BlackoutResponse from(Blackout blackout) {
        return new BlackoutResponse(
                blackout.id(),
                blackout.resourceId(),
                blackout.staffId(),
                blackout.serviceId(),
                blackout.startsAt(),
                blackout.endsAt(),
                blackout.reason(),
                blackout.active()
        );
    }
}
