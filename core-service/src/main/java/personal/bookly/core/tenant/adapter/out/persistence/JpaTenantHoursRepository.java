package personal.bookly.core.tenant.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA Repository for Tenant Hours
 */
public interface JpaTenantHoursRepository extends JpaRepository<TenantHoursEntity, Long> {

    List<TenantHoursEntity> findByTenantIdOrderByDayOfWeekAsc(Long tenantId);

    Optional<TenantHoursEntity> findByTenantIdAndDayOfWeek(Long tenantId, int dayOfWeek);
}
