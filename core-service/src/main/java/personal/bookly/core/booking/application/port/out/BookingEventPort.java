package personal.bookly.core.booking.application.port.out;

import personal.bookly.core.booking.domain.model.BookingChangedEvent;

/**
 * Booking Event Port (Output Port)
 * 커밋 이후 booking.changed 이벤트 발행
 */
public interface BookingEventPort {

    void publish(BookingChangedEvent event);
}
