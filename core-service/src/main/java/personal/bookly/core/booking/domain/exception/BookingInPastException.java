package personal.bookly.core.booking.domain.exception;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;

public class BookingInPastException extends BusinessException {
    public BookingInPastException() {
        super(ErrorCode.BOOKING_IN_PAST);
    }
}
