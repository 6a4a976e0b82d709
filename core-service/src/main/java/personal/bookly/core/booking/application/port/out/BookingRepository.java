package personal.bookly.core.booking.application.port.out;

import personal.bookly.core.booking.domain.model.Booking;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Booking Repository (Output Port)
 */
public interface BookingRepository {

    Optional<Booking> findById(Long tenantId, Long bookingId);

    /**
     * 비관적 락 (PESSIMISTIC_WRITE), 상태 변경 직렬화용
     */
    Optional<Booking> findByIdForUpdate(Long tenantId, Long bookingId);

    Optional<Booking> findByIdempotencyKey(Long tenantId, String idempotencyKey);

    /**
     * [from, to) 사이에 시작하는 예약 (시작 시각 순)
     */
    List<Booking> findStartingBetween(Long tenantId, Instant from, Instant to);

    /**
     * 신규 저장은 즉시 flush 하여 (tenant_id, idempotency_key) 유니크 위반을 드러낸다
     */
    Booking save(Booking booking);
}
