package personal.bookly.core.tenant.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.bookly.core.tenant.application.port.out.TenantRepository;
import personal.bookly.core.tenant.domain.model.Tenant;

import java.util.Optional;

/**
 * Tenant Persistence Adapter
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TenantPersistenceAdapter implements TenantRepository {

    private final JpaTenantRepository jpaTenantRepository;

    @Override
    public Optional<Tenant> findBySlug(String slug) {
        log.debug("Finding tenant: slug={}", slug);
        return jpaTenantRepository.findBySlug(slug)
                .map(TenantEntity::toDomain);
    }

    @Override
    public Optional<Tenant> findById(Long tenantId) {
        return jpaTenantRepository.findById(tenantId)
                .map(TenantEntity::toDomain);
    }
}
