package personal.bookly.core.catalog.domain.model;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;

/**
 * Bookable Service Domain Model
 * 예약 가능한 서비스 (시술, 수업, 대여 등)
 * 외부 관리 화면에서 등록되며 이 서비스에서는 읽기만 한다
 */
public record BookableService(
        Long id,
        Long tenantId,
        String name,
        int durationMinutes,
        Integer slotIntervalMinutes,
        int maxParallelBookings,
        Integer maxConsecutiveSlots,
        boolean requiresStaff,
        boolean requiresResource,
        boolean requiresConfirmation,
        boolean allowMembership,
        AvailabilityBasis availabilityBasis,
        boolean active) {
    public BookableService {
        if (id == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Service ID cannot be null");
        }
        if (tenantId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Tenant ID cannot be null");
        }
        if (durationMinutes <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Service duration must be positive: " + durationMinutes);
        }
    }

    /**
     * 실제 적용되는 가용성 기준
     * AUTO 또는 미설정이면 requires_staff / requires_resource 에서 도출
     */
    public AvailabilityBasis effectiveBasis() {
        if (availabilityBasis == null || availabilityBasis == AvailabilityBasis.AUTO) {
            return AvailabilityBasis.derive(requiresStaff, requiresResource);
        }
        return availabilityBasis;
    }

    /**
     * 슬롯 간격 (미설정이면 서비스 소요시간)
     */
    public int stepMinutes() {
        if (slotIntervalMinutes == null || slotIntervalMinutes <= 0) {
            return durationMinutes;
        }
        return slotIntervalMinutes;
    }

    /**
     * 동시 수용 가능한 예약 수 (최소 1)
     */
    public int capacity() {
        return Math.max(1, maxParallelBookings);
    }

    /**
     * 요청 소요시간의 상한 (연속 슬롯 제한이 없으면 null)
     */
    public Integer maxDurationMinutes() {
        if (maxConsecutiveSlots == null || maxConsecutiveSlots <= 0) {
            return null;
        }
        return stepMinutes() * maxConsecutiveSlots;
    }
}
