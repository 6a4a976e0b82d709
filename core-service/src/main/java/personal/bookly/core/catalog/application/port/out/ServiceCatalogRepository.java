package personal.bookly.core.catalog.application.port.out;

import personal.bookly.core.catalog.domain.model.BookableService;

import java.util.Optional;

/**
 * Service Catalog Repository Port (Output Port)
 */
public interface ServiceCatalogRepository {

    Optional<BookableService> findByIdAndTenantId(Long serviceId, Long tenantId);

    /**
     * 비관적 락(PESSIMISTIC_WRITE)으로 조회
     * 스태프/리소스가 없는 예약의 잠금 기준으로 사용
     */
    Optional<BookableService> findByIdForUpdate(Long serviceId);
}
