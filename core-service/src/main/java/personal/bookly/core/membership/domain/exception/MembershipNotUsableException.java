package personal.bookly.core.membership.domain.exception;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;

/**
 * 비활성, 미시작 또는 만료된 이용권
 */
public class MembershipNotUsableException extends BusinessException {
    public MembershipNotUsableException(Long membershipId) {
        super(ErrorCode.MEMBERSHIP_NOT_USABLE, String.format("Membership is not usable: membershipId=%d", membershipId));
    }
}
