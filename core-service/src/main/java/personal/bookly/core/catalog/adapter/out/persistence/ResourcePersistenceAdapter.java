package personal.bookly.core.catalog.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.bookly.core.catalog.application.port.out.ResourceRepository;
import personal.bookly.core.catalog.domain.model.Resource;

import java.util.Optional;

/**
 * Resource Persistence Adapter
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResourcePersistenceAdapter implements ResourceRepository {

    private final JpaResourceRepository jpaResourceRepository;

    @Override
    public Optional<Resource> findByIdAndTenantId(Long resourceId, Long tenantId) {
        return jpaResourceRepository.findByIdAndTenantId(resourceId, tenantId)
                .map(ResourceEntity::toDomain);
    }

    @Override
    public Optional<Resource> findByIdForUpdate(Long resourceId) {
        log.debug("Locking resource row: resourceId={}", resourceId);
        return jpaResourceRepository.findByIdForUpdate(resourceId)
                .map(ResourceEntity::toDomain);
    }
}
