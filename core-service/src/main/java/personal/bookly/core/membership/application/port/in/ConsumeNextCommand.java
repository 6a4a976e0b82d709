package personal.bookly.core.membership.application.port.in;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;

/**
 * Consume Next Command
 * 차감량은 0 이상이며 둘 다 0일 수 없다
 */
public record ConsumeNextCommand(
        String tenantSlug,
        Long customerId,
        Long bookingId,
        int minutesToDebit,
        int usesToDebit,
        String note
) {
    public ConsumeNextCommand {
        if (tenantSlug == null || tenantSlug.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Tenant cannot be blank");
        }
        if (customerId == null || customerId <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "customerId is required.");
        }
        if (bookingId == null || bookingId <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "bookingId is required (must be a real booking id).");
        }
        if (minutesToDebit < 0 || usesToDebit < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "minutesToDebit and usesToDebit must be >= 0.");
        }
        if (minutesToDebit == 0 && usesToDebit == 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Nothing to debit.");
        }
    }

    public String noteOrDefault() {
        return note == null || note.isBlank() ? "Debit for booking " + bookingId : note.trim();
    }
}
