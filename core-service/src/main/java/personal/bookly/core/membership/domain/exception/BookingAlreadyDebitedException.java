package personal.bookly.core.membership.domain.exception;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;

/**
 * 같은 예약에 대한 중복 차감
 */
public class BookingAlreadyDebitedException extends BusinessException {
    public BookingAlreadyDebitedException(Long bookingId) {
        super(ErrorCode.BOOKING_ALREADY_DEBITED, String.format("Booking already debited: bookingId=%d", bookingId));
    }
}
