package personal.bookly.core.tenant.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.bookly.core.tenant.application.port.in.TenantHeartbeatUseCase;
import personal.bookly.core.tenant.application.port.in.GetTenantUseCase;
import personal.bookly.core.tenant.application.port.out.TenantHeartbeatPort;
import personal.bookly.core.tenant.application.port.out.TenantRepository;
import personal.bookly.core.tenant.domain.exception.TenantNotFoundException;
import personal.bookly.core.tenant.domain.model.Tenant;
import personal.bookly.core.tenant.domain.model.TenantHeartbeat;

import java.time.Instant;

/**
 * Tenant Application Service
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class TenantService implements GetTenantUseCase, TenantHeartbeatUseCase {

    private final TenantRepository tenantRepository;
    private final TenantHeartbeatPort tenantHeartbeatPort;

    @Override
    public Tenant getTenant(String slug) {
        return tenantRepository.findBySlug(slug)
                .orElseThrow(() -> {
                    log.warn("Tenant not found: slug={}", slug);
                    return new TenantNotFoundException(slug);
                });
    }

    @Override
    public TenantHeartbeat getHeartbeat(String tenantSlug) {
        Tenant tenant = getTenant(tenantSlug);
        var lastChange = tenantHeartbeatPort.lastBookingChangeAt(tenant.id()).orElse(null);
        return new TenantHeartbeat(tenant.id(), tenant.slug(), lastChange);
    }

    @Override
    public void recordBookingChange(Long tenantId, Instant changedAt) {
        tenantHeartbeatPort.bump(tenantId, changedAt);
    }
}
