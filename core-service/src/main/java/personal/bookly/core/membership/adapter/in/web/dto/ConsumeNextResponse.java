package personal.bookly.core.membership.adapter.in.web.dto;

import personal.bookly.core.membership.domain.model.ConsumeOutcome;

/**
 * Consume Next Response DTO
 */
public record ConsumeNextResponse(
        CustomerMembershipResponse membership,
        boolean alreadyDebited,
        Long bookingId,
        Long customerMembershipId
) {
    public static ConsumeNextResponse from(ConsumeOutcome outcome, Long bookingId) {
        return new ConsumeNextResponse(
                CustomerMembershipResponse.from(outcome.membership()),
                outcome.alreadyDebited(),
                bookingId,
                outcome.membership().id()
        );
    }
}
