package personal.bookly.core.availability.domain.model;

import personal.bookly.core.catalog.domain.model.AvailabilityBasis;

/**
 * 가용성 응답 메타
 *
 * @param reason 슬롯이 의도적으로 비어 있을 때만 값이 있다
 */
public record AvailabilityMeta(
        int durationMinutes,
        int slotIntervalMinutes,
        int maxParallelBookings,
        AvailabilityBasis availabilityBasis,
        AvailabilityReason reason,
        ScheduleSource scheduleSource) {
}
