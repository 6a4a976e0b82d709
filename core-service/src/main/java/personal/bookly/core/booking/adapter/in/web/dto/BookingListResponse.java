package personal.bookly.core.booking.adapter.in.web.dto;

import java.util.List;

/**
 * 예약 목록 응답 { "bookings": [...] }
 */
public record BookingListResponse(List<BookingResponse> bookings) {
}
