package personal.bookly.core.membership.domain.exception;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;

/**
 * 조건을 만족하는 이용권이 없는 경우
 */
public class NoEligibleEntitlementException extends BusinessException {
    public NoEligibleEntitlementException() {
        super(ErrorCode.NO_ELIGIBLE_ENTITLEMENT);
    }
}
