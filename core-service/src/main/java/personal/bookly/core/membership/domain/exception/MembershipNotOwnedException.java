package personal.bookly.core.membership.domain.exception;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;

/**
 * 다른 고객의 이용권을 사용하려는 경우
 */
public class MembershipNotOwnedException extends BusinessException {
    public MembershipNotOwnedException(Long membershipId) {
        super(ErrorCode.MEMBERSHIP_NOT_OWNED, String.format("Membership does not belong to this customer: membershipId=%s", membershipId));
    }
}
