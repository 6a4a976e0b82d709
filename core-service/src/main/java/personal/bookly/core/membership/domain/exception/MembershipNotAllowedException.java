package personal.bookly.core.membership.domain.exception;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;

/**
 * 이용권 사용이 허용되지 않은 서비스
 */
public class MembershipNotAllowedException extends BusinessException {
    public MembershipNotAllowedException(Long serviceId) {
        super(ErrorCode.MEMBERSHIP_NOT_ALLOWED, String.format("Service does not allow membership use: serviceId=%d", serviceId));
    }
}
