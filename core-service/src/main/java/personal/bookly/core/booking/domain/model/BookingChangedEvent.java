package personal.bookly.core.booking.domain.model;

import java.time.Instant;

/**
 * booking.changed 이벤트 페이로드
 *
 * @param changeType created / status_changed
 */
public record BookingChangedEvent(
        Long tenantId,
        Long bookingId,
        String changeType,
        String status,
        Instant startTime,
        Instant occurredAt) {

    public static BookingChangedEvent created(Booking booking, Instant now) {
        return new BookingChangedEvent(booking.tenantId(), booking.id(), "created",
                booking.status().value(), booking.startTime(), now);
    }

    public static BookingChangedEvent statusChanged(Booking booking, Instant now) {
        return new BookingChangedEvent(booking.tenantId(), booking.id(), "status_changed",
                booking.status().value(), booking.startTime(), now);
    }
}
