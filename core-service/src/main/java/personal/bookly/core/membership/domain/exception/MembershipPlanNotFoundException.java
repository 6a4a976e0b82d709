package personal.bookly.core.membership.domain.exception;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;

/**
 * Membership Plan Not Found Exception
 */
public class MembershipPlanNotFoundException extends BusinessException {
    public MembershipPlanNotFoundException(Long planId) {
        super(ErrorCode.MEMBERSHIP_PLAN_NOT_FOUND, String.format("Plan not found for tenant: planId=%d", planId));
    }
}
