package personal.bookly.core.membership.domain.exception;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;

/**
 * 차감 후 잔액이 음수가 되는 경우
 */
public class InsufficientMembershipBalanceException extends BusinessException {
    public InsufficientMembershipBalanceException(Long membershipId) {
        super(ErrorCode.INSUFFICIENT_MEMBERSHIP_BALANCE, String.format("Insufficient membership balance: membershipId=%d", membershipId));
    }
}
