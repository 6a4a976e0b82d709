package personal.bookly.core.tenant.application.port.out;

import java.time.Instant;
import java.util.Optional;

/**
 * Tenant Heartbeat Port (Output Port)
 * 예약 변경 시각 신호 저장소, 대시보드 폴링이 읽는다
 */
public interface TenantHeartbeatPort {

    void bump(Long tenantId, Instant changedAt);

    Optional<Instant> lastBookingChangeAt(Long tenantId);
}
