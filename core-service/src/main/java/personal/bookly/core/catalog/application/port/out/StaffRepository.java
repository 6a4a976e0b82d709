package personal.bookly.core.catalog.application.port.out;

import personal.bookly.core.catalog.domain.model.Staff;

import java.util.Optional;

/**
 * Staff Repository Port (Output Port)
 */
public interface StaffRepository {

    Optional<Staff> findByIdAndTenantId(Long staffId, Long tenantId);

    Optional<Staff> findByIdForUpdate(Long staffId);
}
