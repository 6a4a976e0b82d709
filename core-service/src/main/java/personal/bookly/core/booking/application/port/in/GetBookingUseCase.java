package personal.bookly.core.booking.application.port.in;

import personal.bookly.core.booking.domain.model.BookingDetails;

import java.time.LocalDate;
import java.util.List;

/**
 * Get Booking UseCase (Input Port)
 */
public interface GetBookingUseCase {

    BookingDetails getBooking(String tenantSlug, Long bookingId);

    /**
     * 테넌트 로컬 날짜 기준 하루치 예약 (시작 시각 순)
     */
    List<BookingDetails> listByDate(String tenantSlug, LocalDate date);
}
