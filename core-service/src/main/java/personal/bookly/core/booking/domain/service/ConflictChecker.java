package personal.bookly.core.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.bookly.core.booking.application.port.out.BookingOccupancyRepository;
import personal.bookly.core.booking.domain.model.ConflictResult;
import personal.bookly.core.booking.domain.model.OccupiedInterval;
import personal.bookly.core.config.BooklyProperties;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conflict Checker
 * 요청 구간 [from, to)과 겹치는 PENDING/CONFIRMED 예약을 찾아 용량 초과 여부를 판단
 *
 * <ul>
 *   <li>스태프와 리소스는 각각 독립된 제약으로 검사 (둘 중 하나라도 가득 차면 충돌)</li>
 *   <li>스태프/리소스가 모두 없으면 같은 서비스의 겹침 수를 용량과 비교</li>
 * </ul>
 * 사전 검사(잠금 없음)와 트랜잭션 내 재검사(잠금 보유) 모두에서 사용된다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConflictChecker {

    private static final int DEFAULT_ROW_LIMIT = 20;

    private final BookingOccupancyRepository occupancyRepository;
    private final BooklyProperties properties;

    public ConflictResult check(Long tenantId, Long serviceId, Long staffId, Long resourceId,
                                Instant from, Instant to, int capacity, Long excludeBookingId) {
        int effectiveCapacity = Math.max(1, capacity);
        int rowLimit = rowLimit();
        int fetchLimit = Math.max(rowLimit, effectiveCapacity);

        List<OccupiedInterval> saturated = new ArrayList<>();

        if (staffId != null) {
            List<OccupiedInterval> rows = occupancyRepository
                    .findOverlappingByStaff(tenantId, staffId, from, to, excludeBookingId, fetchLimit);
            if (rows.size() >= effectiveCapacity) {
                saturated.addAll(rows);
            }
        }

        if (resourceId != null) {
            List<OccupiedInterval> rows = occupancyRepository
                    .findOverlappingByResource(tenantId, resourceId, from, to, excludeBookingId, fetchLimit);
            if (rows.size() >= effectiveCapacity) {
                saturated.addAll(rows);
            }
        }

        if (staffId == null && resourceId == null && serviceId != null) {
            List<OccupiedInterval> rows = occupancyRepository
                    .findOverlappingByService(tenantId, serviceId, from, to, excludeBookingId, fetchLimit);
            if (rows.size() >= effectiveCapacity) {
                saturated.addAll(rows);
            }
        }

        if (saturated.isEmpty()) {
            return ConflictResult.none();
        }

        // 스태프/리소스 양쪽에 잡힌 같은 예약은 한 번만
        Map<Long, OccupiedInterval> distinct = new LinkedHashMap<>();
        saturated.forEach(row -> distinct.putIfAbsent(row.bookingId(), row));

        List<OccupiedInterval> rows = distinct.values().stream()
                .sorted(Comparator.comparing(OccupiedInterval::startTime).thenComparing(OccupiedInterval::bookingId))
                .limit(rowLimit)
                .toList();

        log.debug("Booking conflict: tenantId={}, staffId={}, resourceId={}, serviceId={}, rows={}",
                tenantId, staffId, resourceId, serviceId, rows.size());
        return new ConflictResult(true, rows);
    }

    private int rowLimit() {
        int configured = properties.booking() == null ? 0 : properties.booking().conflictRowLimit();
        return configured > 0 ? configured : DEFAULT_ROW_LIMIT;
    }
}
