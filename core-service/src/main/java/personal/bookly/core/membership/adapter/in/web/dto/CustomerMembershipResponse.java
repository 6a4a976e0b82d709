package personal.bookly.core.membership.adapter.in.web.dto;

import personal.bookly.core.membership.domain.model.CustomerMembership;

import java.time.Instant;

/**
 * Customer Membership Response DTO
 */
public record CustomerMembershipResponse(
        Long id,
        Long customerId,
        Long planId,
        String status,
        Instant startAt,
        Instant endAt,
        long minutesRemaining,
        long usesRemaining
) {
    public static CustomerMembershipResponse from(CustomerMembership membership) {
        return new CustomerMembershipResponse(
                membership.id(),
                membership.customerId(),
                membership.planId(),
                membership.status().value(),
                membership.startAt(),
                membership.endAt(),
                membership.minutesRemaining(),
                membership.usesRemaining()
        );
    }
}
