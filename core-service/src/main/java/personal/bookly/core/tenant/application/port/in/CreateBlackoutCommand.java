package personal.bookly.core.tenant.application.port.in;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;

import java.time.Instant;

/**
 * Create Blackout Command
 */
public record CreateBlackoutCommand(
        String tenantSlug,
        Long resourceId,
        Long staffId,
        Long serviceId,
        Instant startsAt,
        Instant endsAt,
        String reason
) {
    public CreateBlackoutCommand {
        if (tenantSlug == null || tenantSlug.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Tenant cannot be blank");
        }
        if (startsAt == null || endsAt == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "startsAt and endsAt are required");
        }
        if (!endsAt.isAfter(startsAt)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "endsAt must be after startsAt");
        }
    }
}
