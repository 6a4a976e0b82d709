package personal.bookly.core.catalog.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.bookly.core.catalog.application.port.out.ServiceCatalogRepository;
import personal.bookly.core.catalog.domain.model.BookableService;

import java.util.Optional;

/**
 * Service Catalog Persistence Adapter
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ServiceCatalogPersistenceAdapter implements ServiceCatalogRepository {

    private final JpaBookableServiceRepository jpaServiceRepository;

    @Override
    public Optional<BookableService> findByIdAndTenantId(Long serviceId, Long tenantId) {
        return jpaServiceRepository.findByIdAndTenantId(serviceId, tenantId)
                .map(BookableServiceEntity::toDomain);
    }

    @Override
    public Optional<BookableService> findByIdForUpdate(Long serviceId) {
        log.debug("Locking service row: serviceId={}", serviceId);
        return jpaServiceRepository.findByIdForUpdate(serviceId)
                .map(BookableServiceEntity::toDomain);
    }
}
