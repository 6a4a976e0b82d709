package personal.bookly.core.tenant.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.bookly.core.catalog.application.port.in.GetCatalogUseCase;
import personal.bookly.core.tenant.application.port.in.CheckBlackoutUseCase;
import personal.bookly.core.tenant.application.port.in.CreateBlackoutCommand;
import personal.bookly.core.tenant.application.port.in.GetTenantUseCase;
import personal.bookly.core.tenant.application.port.in.ManageBlackoutUseCase;
import personal.bookly.core.tenant.application.port.out.BlackoutRepository;
import personal.bookly.core.tenant.domain.exception.BlackoutNotFoundException;
import personal.bookly.core.tenant.domain.exception.BlackoutOverlapException;
import personal.bookly.core.tenant.domain.model.Blackout;
import personal.bookly.core.tenant.domain.model.Tenant;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Blackout Service
 * 차단 구간 관리 및 가용성/예약용 조회
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class BlackoutService implements ManageBlackoutUseCase, CheckBlackoutUseCase {

    private final GetTenantUseCase getTenantUseCase;
    private final GetCatalogUseCase getCatalogUseCase;
    private final BlackoutRepository blackoutRepository;
    private final Clock clock;

    @Override
    @Transactional
    public Blackout create(CreateBlackoutCommand command) {
        Tenant tenant = getTenantUseCase.getTenant(command.tenantSlug());

        // 참조 대상은 모두 같은 테넌트 소속이어야 함
        if (command.serviceId() != null) {
            getCatalogUseCase.getService(tenant.id(), command.serviceId());
        }
        if (command.staffId() != null) {
            getCatalogUseCase.getStaff(tenant.id(), command.staffId());
        }
        if (command.resourceId() != null) {
            getCatalogUseCase.getResource(tenant.id(), command.resourceId());
        }

        Blackout candidate = Blackout.create(tenant.id(), command.resourceId(), command.staffId(),
                command.serviceId(), command.startsAt(), command.endsAt(), command.reason(), Instant.now(clock));

        blackoutRepository.findInRange(tenant.id(), command.startsAt(), command.endsAt(), false).stream()
                .filter(existing -> existing.hasSameScope(candidate))
                .findFirst()
                .ifPresent(existing -> {
                    log.warn("Blackout overlap: tenantId={}, existingId={}", tenant.id(), existing.id());
                    throw new BlackoutOverlapException(existing.id());
                });

        Blackout saved = blackoutRepository.save(candidate);
        log.info("Blackout created: tenantId={}, blackoutId={}, startsAt={}, endsAt={}",
                tenant.id(), saved.id(), saved.startsAt(), saved.endsAt());
        return saved;
    }

    @Override
    public List<Blackout> list(String tenantSlug, Instant from, Instant to, boolean includeInactive) {
        Tenant tenant = getTenantUseCase.getTenant(tenantSlug);
        return blackoutRepository.findInRange(tenant.id(), from, to, includeInactive);
    }

    @Override
    @Transactional
    public Blackout deactivate(String tenantSlug, Long blackoutId) {
        Tenant tenant = getTenantUseCase.getTenant(tenantSlug);
        Blackout blackout = blackoutRepository.findByIdAndTenantId(blackoutId, tenant.id())
                .orElseThrow(() -> {
                    log.warn("Blackout not found: tenantId={}, blackoutId={}", tenant.id(), blackoutId);
                    return new BlackoutNotFoundException(blackoutId);
                });

        Blackout deactivated = blackoutRepository.save(blackout.deactivate());
        log.info("Blackout deactivated: tenantId={}, blackoutId={}", tenant.id(), blackoutId);
        return deactivated;
    }

    @Override
    public List<Blackout> findBlocking(Long tenantId, Instant from, Instant to,
                                       Long serviceId, Long staffId, Long resourceId) {
        return blackoutRepository.findActiveBlocking(tenantId, from, to, serviceId, staffId, resourceId);
    }
}
