package personal.bookly.core.availability.adapter.out.booking;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.bookly.core.availability.application.port.out.BusyIntervalPort;
import personal.bookly.core.availability.domain.model.OccupiedSpan;
import personal.bookly.core.booking.application.port.out.BookingOccupancyRepository;
import personal.bookly.core.booking.domain.model.OccupiedInterval;

import java.time.Instant;
import java.util.List;

/**
 * Booking Busy Interval Adapter
 * 가용성 계산용 점유 구간을 booking 도메인의 고정 쿼리로 조회
 */
@Component
@RequiredArgsConstructor
public class BookingBusyIntervalAdapter implements BusyIntervalPort {

    private static final Long NO_EXCLUSION = null;
    private static final int MAX_ROWS_PER_DAY = 2000;

    private final BookingOccupancyRepository occupancyRepository;

    @Override
    public List<OccupiedSpan> findByService(Long tenantId, Long serviceId, Instant from, Instant to) {
        return toSpans(occupancyRepository.findOverlappingByService(
                tenantId, serviceId, from, to, NO_EXCLUSION, MAX_ROWS_PER_DAY));
    }

    @Override
    public List<OccupiedSpan> findByStaff(Long tenantId, Long staffId, Instant from, Instant to) {
        return toSpans(occupancyRepository.findOverlappingByStaff(
                tenantId, staffId, from, to, NO_EXCLUSION, MAX_ROWS_PER_DAY));
    }

    @Override
    public List<OccupiedSpan> findByResource(Long tenantId, Long resourceId, Instant from, Instant to) {
        return toSpans(occupancyRepository.findOverlappingByResource(
                tenantId, resourceId, from, to, NO_EXCLUSION, MAX_ROWS_PER_DAY));
    }

    private List<OccupiedSpan> toSpans(List<OccupiedInterval> rows) {
        return rows.stream()
                .map(row -> new OccupiedSpan(row.startTime(), row.endTime()))
                .toList();
    }
}
