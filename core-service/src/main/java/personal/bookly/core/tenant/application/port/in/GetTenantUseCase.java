package personal.bookly.core.tenant.application.port.in;

import personal.bookly.core.tenant.domain.model.Tenant;

/**
 * Get Tenant UseCase (Input Port)
 */
public interface GetTenantUseCase {

    /**
     * slug로 테넌트 조회
     *
     * @throws personal.bookly.core.tenant.domain.exception.TenantNotFoundException 테넌트가 없을 때
     */
    Tenant getTenant(String slug);
}
