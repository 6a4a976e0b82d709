package personal.bookly.core.availability.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * 슬롯 계산에 쓰이는 점유 현황
 * 비어 있는 차원(null)은 용량 판단에 쓰지 않는다
 *
 * @param byService  스태프/리소스가 없을 때 같은 서비스의 예약
 * @param byStaff    선택한 스태프의 예약
 * @param byResource 선택한 리소스의 예약
 * @param blackouts  적용되는 활성 블랙아웃
 */
public record Occupancy(
        List<OccupiedSpan> byService,
        List<OccupiedSpan> byStaff,
        List<OccupiedSpan> byResource,
        List<OccupiedSpan> blackouts) {

    public static int count(List<OccupiedSpan> spans, Instant start, Instant end) {
        if (spans == null) {
            return 0;
        }
        return (int) spans.stream().filter(span -> span.overlaps(start, end)).count();
    }
}
