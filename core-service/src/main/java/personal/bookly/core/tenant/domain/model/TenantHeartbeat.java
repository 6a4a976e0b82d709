package personal.bookly.core.tenant.domain.model;

import java.time.Instant;

/**
 * 대시보드 폴링용 마지막 예약 변경 시각
 */
public record TenantHeartbeat(Long tenantId, String slug, Instant lastBookingChangeAt) {
}
