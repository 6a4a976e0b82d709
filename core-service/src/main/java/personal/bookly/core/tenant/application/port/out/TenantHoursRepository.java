package personal.bookly.core.tenant.application.port.out;

import personal.bookly.core.tenant.domain.model.TenantHours;

import java.util.List;
import java.util.Optional;

/**
 * Tenant Hours Repository Port (Output Port)
 */
public interface TenantHoursRepository {

    List<TenantHours> findByTenantId(Long tenantId);

    Optional<TenantHours> findByTenantIdAndDayOfWeek(Long tenantId, int dayOfWeek);

    TenantHours save(TenantHours tenantHours);
}
