package personal.bookly.core.catalog.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.bookly.core.catalog.application.port.out.StaffRepository;
import personal.bookly.core.catalog.domain.model.Staff;

import java.util.Optional;

/**
 * Staff Persistence Adapter
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StaffPersistenceAdapter implements StaffRepository {

    private final JpaStaffRepository jpaStaffRepository;

    @Override
    public Optional<Staff> findByIdAndTenantId(Long staffId, Long tenantId) {
        return jpaStaffRepository.findByIdAndTenantId(staffId, tenantId)
                .map(StaffEntity::toDomain);
    }

    @Override
    public Optional<Staff> findByIdForUpdate(Long staffId) {
        log.debug("Locking staff row: staffId={}", staffId);
        return jpaStaffRepository.findByIdForUpdate(staffId)
                .map(StaffEntity::toDomain);
    }
}
