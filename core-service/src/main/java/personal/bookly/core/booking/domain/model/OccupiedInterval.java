package personal.bookly.core.booking.domain.model;

import java.time.Instant;

/**
 * 시간을 점유 중인 기존 예약 (충돌 응답 행)
 */
public record OccupiedInterval(
        Long bookingId,
        Long serviceId,
        Long staffId,
        Long resourceId,
        Instant startTime,
        Instant endTime,
        BookingStatus status) {
}
