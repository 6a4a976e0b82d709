package personal.bookly.core.booking.adapter.in.web.dto;

import personal.bookly.core.booking.domain.model.BookingCreation;

/**
 * Create Booking Response DTO
 *
 * @param replay 같은 Idempotency-Key로 이미 생성된 예약을 반환한 경우 true
 */
public record CreateBookingResponse(BookingResponse booking, boolean replay) {

    public static CreateBookingResponse from(BookingCreation creation) {
        return new CreateBookingResponse(BookingResponse.from(creation.details()), creation.replay());
    }
}
