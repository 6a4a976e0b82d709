package personal.bookly.core.catalog.application.port.in;

import personal.bookly.core.catalog.domain.model.BookableService;
import personal.bookly.core.catalog.domain.model.Resource;
import personal.bookly.core.catalog.domain.model.Staff;

/**
 * Get Catalog UseCase (Input Port)
 * 테넌트 소속 서비스/스태프/리소스 조회
 */
public interface GetCatalogUseCase {

    /**
     * @throws personal.bookly.core.catalog.domain.exception.ServiceNotFoundException 테넌트 소속이 아니거나 비활성일 때
     */
    BookableService getService(Long tenantId, Long serviceId);

    /**
     * @throws personal.bookly.core.catalog.domain.exception.StaffNotFoundException 테넌트 소속이 아닐 때
     */
    Staff getStaff(Long tenantId, Long staffId);

    /**
     * @throws personal.bookly.core.catalog.domain.exception.ResourceNotFoundException 테넌트 소속이 아닐 때
     */
    Resource getResource(Long tenantId, Long resourceId);

    /**
     * 예약 조회 응답용 이름 조회 (비활성 서비스 포함, 없으면 null)
     */
    CatalogNames findNames(Long tenantId, Long serviceId, Long staffId, Long resourceId);
}
