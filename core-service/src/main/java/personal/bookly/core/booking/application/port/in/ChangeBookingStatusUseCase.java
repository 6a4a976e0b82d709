package personal.bookly.core.booking.application.port.in;

import personal.bookly.core.booking.domain.model.BookingDetails;
import personal.bookly.core.booking.domain.model.BookingStatus;

/**
 * Change Booking Status UseCase (Input Port)
 */
public interface ChangeBookingStatusUseCase {

    /**
     * 관리자 상태 변경, 같은 상태 요청은 변경 없이 현재 예약 반환
     */
    BookingDetails changeStatus(String tenantSlug, Long bookingId, BookingStatus target);

    /**
     * 고객 본인 취소 (예약 이메일과 인증 이메일이 일치해야 함)
     */
    BookingDetails cancelByCustomer(String tenantSlug, Long bookingId, String customerEmail);
}
