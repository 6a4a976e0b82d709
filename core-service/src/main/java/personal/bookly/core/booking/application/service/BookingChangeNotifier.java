package personal.bookly.core.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.bookly.core.booking.application.port.out.BookingEventPort;
import personal.bookly.core.booking.domain.model.Booking;
import personal.bookly.core.booking.domain.model.BookingChangedEvent;
import personal.bookly.core.tenant.application.port.in.TenantHeartbeatUseCase;

import java.time.Clock;
import java.time.Instant;

/**
 * 커밋 이후 예약 변경 알림 (heartbeat + booking.changed 이벤트)
 * 알림 실패는 WARN 로그만 남기고 예약 결과에 영향을 주지 않는다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingChangeNotifier {

    private final TenantHeartbeatUseCase tenantHeartbeatUseCase;
    private final BookingEventPort bookingEventPort;
    private final Clock clock;

    public void bookingCreated(Booking booking) {
        notify(booking, BookingChangedEvent.created(booking, clock.instant()));
    }

    public void statusChanged(Booking booking) {
        notify(booking, BookingChangedEvent.statusChanged(booking, clock.instant()));
    }

    private void notify(Booking booking, BookingChangedEvent event) {
        Instant now = event.occurredAt();
        try {
            tenantHeartbeatUseCase.recordBookingChange(booking.tenantId(), now);
        } catch (RuntimeException e) {
            log.warn("Heartbeat bump failed: tenantId={}, bookingId={}, error={}",
                    booking.tenantId(), booking.id(), e.getMessage());
        }

        try {
            bookingEventPort.publish(event);
        } catch (RuntimeException e) {
            log.warn("Booking event publish failed: tenantId={}, bookingId={}, error={}",
                    booking.tenantId(), booking.id(), e.getMessage());
        }
    }
}
