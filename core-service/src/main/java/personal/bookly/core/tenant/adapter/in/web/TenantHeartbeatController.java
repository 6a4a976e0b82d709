package personal.bookly.core.tenant.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.bookly.core.tenant.adapter.in.web.dto.TenantHeartbeatResponse;
import personal.bookly.core.tenant.application.port.in.TenantHeartbeatUseCase;

/**
 * Tenant Heartbeat API Controller
 * 대시보드가 폴링하는 마지막 예약 변경 시각
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/tenants")
@RequiredArgsConstructor
public class TenantHeartbeatController {

    private final TenantHeartbeatUseCase tenantHeartbeatUseCase;

    @GetMapping("/{slug}/heartbeat")
    public ResponseEntity<TenantHeartbeatResponse> heartbeat(@PathVariable String slug) {
        log.debug("Get heartbeat: tenant={}", slug);
        return ResponseEntity.ok(TenantHeartbeatResponse.from(tenantHeartbeatUseCase.getHeartbeat(slug)));
    }
}
