package personal.bookly.core.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import personal.bookly.core.booking.application.port.out.BookingOccupancyRepository;
import personal.bookly.core.booking.domain.model.BookingStatus;
import personal.bookly.core.booking.domain.model.OccupiedInterval;

import java.time.Instant;
import java.util.List;

/**
 * Booking Occupancy Persistence Adapter
 */
@Component
@RequiredArgsConstructor
public class BookingOccupancyPersistenceAdapter implements BookingOccupancyRepository {

    // 제외할 예약이 없을 때 사용 (IDENTITY는 1부터 시작)
    private static final Long NO_EXCLUSION = 0L;

    private final JpaBookingRepository jpaBookingRepository;

    @Override
    public List<OccupiedInterval> findOverlappingByService(Long tenantId, Long serviceId, Instant from, Instant to,
                                                           Long excludeBookingId, int limit) {
        return toIntervals(jpaBookingRepository.findOverlappingByService(tenantId, serviceId,
                BookingStatus.OCCUPYING, from, to, exclusion(excludeBookingId), PageRequest.of(0, limit)));
    }

    @Override
    public List<OccupiedInterval> findOverlappingByStaff(Long tenantId, Long staffId, Instant from, Instant to,
                                                         Long excludeBookingId, int limit) {
        return toIntervals(jpaBookingRepository.findOverlappingByStaff(tenantId, staffId,
                BookingStatus.OCCUPYING, from, to, exclusion(excludeBookingId), PageRequest.of(0, limit)));
    }

    @Override
    public List<OccupiedInterval> findOverlappingByResource(Long tenantId, Long resourceId, Instant from, Instant to,
                                                            Long excludeBookingId, int limit) {
        return toIntervals(jpaBookingRepository.findOverlappingByResource(tenantId, resourceId,
                BookingStatus.OCCUPYING, from, to, exclusion(excludeBookingId), PageRequest.of(0, limit)));
    }

    private static Long exclusion(Long excludeBookingId) {
        return excludeBookingId == null ? NO_EXCLUSION : excludeBookingId;
    }

    private static List<OccupiedInterval> toIntervals(List<BookingEntity> entities) {
        return entities.stream().map(BookingEntity::toInterval).toList();
    }
}
