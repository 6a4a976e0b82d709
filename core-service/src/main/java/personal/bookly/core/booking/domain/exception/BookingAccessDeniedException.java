package personal.bookly.core.booking.domain.exception;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;

/**
 * Booking Access Denied Exception
 * 다른 고객의 예약을 취소하려 할 때 (403)
 */
public class BookingAccessDeniedException extends BusinessException {
    public BookingAccessDeniedException(Long bookingId) {
        super(ErrorCode.BOOKING_ACCESS_DENIED, String.format("Booking does not belong to caller: bookingId=%d", bookingId));
    }
}
