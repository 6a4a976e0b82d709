package personal.bookly.core.membership.adapter.out.booking;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.bookly.core.booking.application.port.out.BookingRepository;
import personal.bookly.core.membership.application.port.out.BookingReferencePort;

/**
 * Booking Reference Adapter
 * 차감 대상 예약 존재 확인 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingReferenceAdapter implements BookingReferencePort {

    private final BookingRepository bookingRepository;

    @Override
    public boolean existsInTenant(Long tenantId, Long bookingId) {
        boolean exists = bookingRepository.findById(tenantId, bookingId).isPresent();
        log.debug("Booking reference checked: tenantId={}, bookingId={}, exists={}", tenantId, bookingId, exists);
        return exists;
    }
}
