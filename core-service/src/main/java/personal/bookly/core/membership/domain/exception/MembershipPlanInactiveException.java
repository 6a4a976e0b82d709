package personal.bookly.core.membership.domain.exception;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;

/**
 * 판매 중지된 플랜
 */
public class MembershipPlanInactiveException extends BusinessException {
    public MembershipPlanInactiveException(Long planId) {
        super(ErrorCode.MEMBERSHIP_PLAN_INACTIVE, String.format("Plan is not active: planId=%d", planId));
    }
}
