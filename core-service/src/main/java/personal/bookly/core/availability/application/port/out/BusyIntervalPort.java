package personal.bookly.core.availability.application.port.out;

import personal.bookly.core.availability.domain.model.OccupiedSpan;

import java.time.Instant;
import java.util.List;

/**
 * Busy Interval Port (Output Port)
 * [from, to)와 겹치는 PENDING/CONFIRMED 예약 구간
 */
public interface BusyIntervalPort {

    List<OccupiedSpan> findByService(Long tenantId, Long serviceId, Instant from, Instant to);

    List<OccupiedSpan> findByStaff(Long tenantId, Long staffId, Instant from, Instant to);

    List<OccupiedSpan> findByResource(Long tenantId, Long resourceId, Instant from, Instant to);
}
