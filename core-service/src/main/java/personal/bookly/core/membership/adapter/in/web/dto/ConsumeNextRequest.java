package personal.bookly.core.membership.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import personal.bookly.core.membership.application.port.in.ConsumeNextCommand;

/**
 * Consume Next Request DTO
 */
public record ConsumeNextRequest(
        @NotNull(message = "customerId is required.") Long customerId,
        @NotNull(message = "bookingId is required (must be a real booking id).") Long bookingId,
        Integer minutesToDebit,
        Integer usesToDebit,
        @Size(max = 500) String note
) {
    public ConsumeNextCommand toCommand(String tenantSlug) {
        return new ConsumeNextCommand(tenantSlug, customerId, bookingId,
                minutesToDebit == null ? 0 : minutesToDebit,
                usesToDebit == null ? 0 : usesToDebit,
                note);
    }
}
