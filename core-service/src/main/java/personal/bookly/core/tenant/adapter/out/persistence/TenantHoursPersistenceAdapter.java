package personal.bookly.core.tenant.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.bookly.core.tenant.application.port.out.TenantHoursRepository;
import personal.bookly.core.tenant.domain.model.TenantHours;

import java.util.List;
import java.util.Optional;

/**
 * Tenant Hours Persistence Adapter
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TenantHoursPersistenceAdapter implements TenantHoursRepository {

    private final JpaTenantHoursRepository jpaTenantHoursRepository;

    @Override
    public List<TenantHours> findByTenantId(Long tenantId) {
        return jpaTenantHoursRepository.findByTenantIdOrderByDayOfWeekAsc(tenantId).stream()
                .map(TenantHoursEntity::toDomain)
                .toList();
    }

    @Override
    public Optional<TenantHours> findByTenantIdAndDayOfWeek(Long tenantId, int dayOfWeek) {
        return jpaTenantHoursRepository.findByTenantIdAndDayOfWeek(tenantId, dayOfWeek)
                .map(TenantHoursEntity::toDomain);
    }

    @Override
    public TenantHours save(TenantHours tenantHours) {
        log.debug("Saving tenant hours: tenantId={}, dayOfWeek={}", tenantHours.tenantId(), tenantHours.dayOfWeek());
        return jpaTenantHoursRepository.save(TenantHoursEntity.fromDomain(tenantHours)).toDomain();
    }
}
