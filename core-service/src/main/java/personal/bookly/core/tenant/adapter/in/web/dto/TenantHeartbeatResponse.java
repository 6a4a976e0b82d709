package personal.bookly.core.tenant.adapter.in.web.dto;

import personal.bookly.core.tenant.domain.model.TenantHeartbeat;

import java.time.Instant;

public record TenantHeartbeatResponse(String tenant, Instant lastBookingChangeAt) {

    public static TenantHeartbeatResponse from(TenantHeartbeat heartbeat) {
        return new TenantHeartbeatResponse(heartbeat.slug(), heartbeat.lastBookingChangeAt());
    }
}
