package personal.bookly.core.membership.domain.exception;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;

/**
 * Membership Not Found Exception
 */
public class MembershipNotFoundException extends BusinessException {
    public MembershipNotFoundException(Long membershipId) {
        super(ErrorCode.MEMBERSHIP_NOT_FOUND, String.format("Membership not found: membershipId=%d", membershipId));
    }
}
