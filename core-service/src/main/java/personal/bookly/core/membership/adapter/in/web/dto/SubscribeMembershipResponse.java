package personal.bookly.core.membership.adapter.in.web.dto;

import personal.bookly.core.membership.domain.model.SubscribeOutcome;

/**
 * Subscribe Membership Response DTO
 */
public record SubscribeMembershipResponse(CustomerMembershipResponse membership, boolean alreadyActive) {

    public static SubscribeMembershipResponse from(SubscribeOutcome outcome) {
        return new SubscribeMembershipResponse(
                CustomerMembershipResponse.from(outcome.membership()), outcome.alreadyActive());
    }
}
