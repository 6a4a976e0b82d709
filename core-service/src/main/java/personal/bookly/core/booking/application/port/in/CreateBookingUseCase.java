package personal.bookly.core.booking.application.port.in;

import personal.bookly.core.booking.domain.model.BookingCreation;

/**
 * Create Booking UseCase (Input Port)
 */
public interface CreateBookingUseCase {

    /**
     * 예약 생성
     * 같은 Idempotency-Key로 이미 생성된 예약이 있으면 새로 만들지 않고 replay로 반환
     *
     * @throws personal.bookly.core.booking.domain.exception.BookingConflictException 겹치는 예약이 용량을 채운 경우
     * @throws personal.bookly.core.booking.domain.exception.BookingBlockedException  블랙아웃 구간인 경우
     */
    BookingCreation createBooking(CreateBookingCommand command);
}
