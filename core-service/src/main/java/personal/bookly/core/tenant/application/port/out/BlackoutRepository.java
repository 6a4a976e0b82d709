package personal.bookly.core.tenant.application.port.out;

import personal.bookly.core.tenant.domain.model.Blackout;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Blackout Repository Port (Output Port)
 */
public interface BlackoutRepository {

    Blackout save(Blackout blackout);

    Optional<Blackout> findByIdAndTenantId(Long blackoutId, Long tenantId);

    /**
     * [from, to)와 겹치고 요청 범위에 적용되는 활성 블랙아웃
     * 각 scope 컬럼은 NULL(전체) 이거나 요청 ID와 같아야 한다
     */
    List<Blackout> findActiveBlocking(Long tenantId, Instant from, Instant to,
                                      Long serviceId, Long staffId, Long resourceId);

    List<Blackout> findInRange(Long tenantId, Instant from, Instant to, boolean includeInactive);
}
