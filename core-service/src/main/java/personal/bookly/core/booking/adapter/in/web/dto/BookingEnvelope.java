package personal.bookly.core.booking.adapter.in.web.dto;

import personal.bookly.core.booking.domain.model.BookingDetails;

/**
 * 단건 예약 응답 { "booking": {...} }
 */
public record BookingEnvelope(BookingResponse booking) {

    public static BookingEnvelope from(BookingDetails details) {
        return new BookingEnvelope(BookingResponse.from(details));
    }
}
