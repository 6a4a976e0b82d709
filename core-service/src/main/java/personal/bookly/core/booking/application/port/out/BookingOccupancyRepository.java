package personal.bookly.core.booking.application.port.out;

import personal.bookly.core.booking.domain.model.OccupiedInterval;

import java.time.Instant;
import java.util.List;

/**
 * Booking Occupancy Repository (Output Port)
 * 기준(서비스/스태프/리소스)별로 고정된 쿼리 하나씩
 * 대상: PENDING/CONFIRMED, 겹침: start < to and end > from, 시작 시각 순
 *
 * @see personal.bookly.core.booking.domain.model.BookingStatus#OCCUPYING
 */
public interface BookingOccupancyRepository {

    List<OccupiedInterval> findOverlappingByService(Long tenantId, Long serviceId, Instant from, Instant to,
                                                    Long excludeBookingId, int limit);

    List<OccupiedInterval> findOverlappingByStaff(Long tenantId, Long staffId, Instant from, Instant to,
                                                  Long excludeBookingId, int limit);

    List<OccupiedInterval> findOverlappingByResource(Long tenantId, Long resourceId, Instant from, Instant to,
                                                     Long excludeBookingId, int limit);
}
