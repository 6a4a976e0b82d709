package personal.bookly.core.tenant.application.port.in;

import personal.bookly.core.tenant.domain.model.TenantHeartbeat;

import java.time.Instant;

/**
 * Tenant Heartbeat UseCase (Input Port)
 * 예약 변경 신호 기록 / 조회
 */
public interface TenantHeartbeatUseCase {

    TenantHeartbeat getHeartbeat(String tenantSlug);

    void recordBookingChange(Long tenantId, Instant changedAt);
}
