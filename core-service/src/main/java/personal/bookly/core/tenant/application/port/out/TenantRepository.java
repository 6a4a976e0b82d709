package personal.bookly.core.tenant.application.port.out;

import personal.bookly.core.tenant.domain.model.Tenant;

import java.util.Optional;

/**
 * Tenant Repository Port (Output Port)
 */
public interface TenantRepository {

    Optional<Tenant> findBySlug(String slug);

    Optional<Tenant> findById(Long tenantId);
}
