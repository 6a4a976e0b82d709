package personal.bookly.core.membership.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import personal.bookly.core.membership.application.port.in.SubscribeMembershipCommand;

/**
 * Subscribe Membership Request DTO
 */
public record SubscribeMembershipRequest(
        @NotNull(message = "customerId is required.") Long customerId,
        @NotNull(message = "membershipPlanId is required.") Long membershipPlanId
) {
    public SubscribeMembershipCommand toCommand(String tenantSlug) {
        return new SubscribeMembershipCommand(tenantSlug, customerId, membershipPlanId);
    }
}
