package personal.bookly.core.tenant.domain.model;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;

import java.time.Instant;
import java.util.Objects;

/**
 * Blackout Domain Model
 * 테넌트 휴무/차단 구간 [startsAt, endsAt)
 * resource/staff/service가 null이면 해당 차원 전체에 적용
 */
public record Blackout(
        Long id,
        Long tenantId,
        Long resourceId,
        Long staffId,
        Long serviceId,
        Instant startsAt,
        Instant endsAt,
        String reason,
        boolean active,
        Instant createdAt) {
    public Blackout {
        if (tenantId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Tenant ID cannot be null");
        }
        if (startsAt == null || endsAt == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Blackout start and end are required");
        }
        if (!endsAt.isAfter(startsAt)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Blackout end must be after start");
        }
    }

    public static Blackout create(Long tenantId, Long resourceId, Long staffId, Long serviceId,
                                  Instant startsAt, Instant endsAt, String reason, Instant now) {
        return new Blackout(null, tenantId, resourceId, staffId, serviceId, startsAt, endsAt, reason, true, now);
    }

    public Blackout deactivate() {
        return new Blackout(id, tenantId, resourceId, staffId, serviceId, startsAt, endsAt, reason, false, createdAt);
    }

    public boolean overlaps(Instant from, Instant to) {
        return startsAt.isBefore(to) && endsAt.isAfter(from);
    }

    /**
     * 같은 범위(scope)의 블랙아웃인지
     */
    public boolean hasSameScope(Blackout other) {
        return Objects.equals(resourceId, other.resourceId)
                && Objects.equals(staffId, other.staffId)
                && Objects.equals(serviceId, other.serviceId);
    }
}
