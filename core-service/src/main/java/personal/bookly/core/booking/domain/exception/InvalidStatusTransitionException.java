package personal.bookly.core.booking.domain.exception;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;
import personal.bookly.core.booking.domain.model.BookingStatus;

/**
 * Invalid Status Transition Exception
 * 허용되지 않은 예약 상태 전이 (예: cancelled -> confirmed)
 * HTTP 409 Conflict 반환용
 */
public class InvalidStatusTransitionException extends BusinessException {
    public InvalidStatusTransitionException(Long bookingId, BookingStatus from, BookingStatus to) {
        super(ErrorCode.INVALID_STATUS_TRANSITION,
                String.format("Invalid status transition: %s -> %s (bookingId=%d)", from.value(), to.value(), bookingId));
    }
}
