package personal.bookly.core.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.bookly.core.booking.application.port.out.BookingRepository;
import personal.bookly.core.booking.domain.model.Booking;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Booking Persistence Adapter
 * JPA를 사용한 예약 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingPersistenceAdapter implements BookingRepository {

    private final JpaBookingRepository jpaBookingRepository;

    @Override
    public Optional<Booking> findById(Long tenantId, Long bookingId) {
        return jpaBookingRepository.findByIdAndTenantId(bookingId, tenantId)
                .map(BookingEntity::toDomain);
    }

    @Override
    public Optional<Booking> findByIdForUpdate(Long tenantId, Long bookingId) {
        log.debug("Locking booking row: tenantId={}, bookingId={}", tenantId, bookingId);
        return jpaBookingRepository.findByIdForUpdate(tenantId, bookingId)
                .map(BookingEntity::toDomain);
    }

    @Override
    public Optional<Booking> findByIdempotencyKey(Long tenantId, String idempotencyKey) {
        return jpaBookingRepository.findByTenantIdAndIdempotencyKey(tenantId, idempotencyKey)
                .map(BookingEntity::toDomain);
    }

    @Override
    public List<Booking> findStartingBetween(Long tenantId, Instant from, Instant to) {
        return jpaBookingRepository.findStartingBetween(tenantId, from, to).stream()
                .map(BookingEntity::toDomain)
                .toList();
    }

    @Override
    public Booking save(Booking booking) {
        if (booking.id() == null) {
            BookingEntity saved = jpaBookingRepository.saveAndFlush(BookingEntity.fromDomain(booking));
            log.debug("Booking inserted: tenantId={}, bookingId={}", saved.getTenantId(), saved.getId());
            return saved.toDomain();
        }
        BookingEntity entity = jpaBookingRepository.findById(booking.id())
                .orElseGet(() -> BookingEntity.fromDomain(booking));
        entity.apply(booking);
        return jpaBookingRepository.save(entity).toDomain();
    }
}
