package personal.bookly.core.schedule.application.port.in;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;
import personal.bookly.core.schedule.domain.model.OverrideType;

import java.time.LocalDate;

/**
 * Create Override Command
 */
public record CreateOverrideCommand(
        String tenantSlug,
        Long staffId,
        LocalDate date,
        OverrideType type,
        Integer startMinute,
        Integer endMinute
) {
    public CreateOverrideCommand {
        if (tenantSlug == null || tenantSlug.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Tenant cannot be blank");
        }
        if (staffId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Staff ID cannot be null");
        }
    }
}
