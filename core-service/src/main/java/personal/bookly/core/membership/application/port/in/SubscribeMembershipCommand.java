package personal.bookly.core.membership.application.port.in;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;

/**
 * Subscribe Membership Command
 */
public record SubscribeMembershipCommand(String tenantSlug, Long customerId, Long membershipPlanId) {
    public SubscribeMembershipCommand {
        if (tenantSlug == null || tenantSlug.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Tenant cannot be blank");
        }
        if (customerId == null || customerId <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "customerId is required.");
        }
        if (membershipPlanId == null || membershipPlanId <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "membershipPlanId is required.");
        }
    }
}
