package personal.bookly.core.tenant.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.bookly.core.tenant.application.port.out.BlackoutRepository;
import personal.bookly.core.tenant.domain.model.Blackout;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Blackout Persistence Adapter
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BlackoutPersistenceAdapter implements BlackoutRepository {

    private final JpaBlackoutRepository jpaBlackoutRepository;

    @Override
    public Blackout save(Blackout blackout) {
        log.debug("Saving blackout: tenantId={}, startsAt={}, endsAt={}",
                blackout.tenantId(), blackout.startsAt(), blackout.endsAt());
        return jpaBlackoutRepository.save(BlackoutEntity.fromDomain(blackout)).toDomain();
    }

    @Override
    public Optional<Blackout> findByIdAndTenantId(Long blackoutId, Long tenantId) {
        return jpaBlackoutRepository.findByIdAndTenantId(blackoutId, tenantId)
                .map(BlackoutEntity::toDomain);
    }

    @Override
    public List<Blackout> findActiveBlocking(Long tenantId, Instant from, Instant to,
                                             Long serviceId, Long staffId, Long resourceId) {
        return jpaBlackoutRepository.findActiveBlocking(tenantId, from, to, serviceId, staffId, resourceId).stream()
                .map(BlackoutEntity::toDomain)
                .toList();
    }

    @Override
    public List<Blackout> findInRange(Long tenantId, Instant from, Instant to, boolean includeInactive) {
        return jpaBlackoutRepository.findInRange(tenantId, from, to, includeInactive).stream()
                .map(BlackoutEntity::toDomain)
                .toList();
    }
}
