package personal.bookly.core.catalog.application.port.out;

import personal.bookly.core.catalog.domain.model.Resource;

import java.util.Optional;

/**
 * Resource Repository Port (Output Port)
 */
public interface ResourceRepository {

    Optional<Resource> findByIdAndTenantId(Long resourceId, Long tenantId);

    Optional<Resource> findByIdForUpdate(Long resourceId);
}
