package personal.bookly.core.tenant.domain.exception;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;

/**
 * Tenant Not Found Exception
 * slug에 해당하는 테넌트가 없을 때 발생
 */
public class TenantNotFoundException extends BusinessException {
    public TenantNotFoundException(String slug) {
        super(ErrorCode.TENANT_NOT_FOUND, String.format("Tenant not found: slug=%s", slug));
    }
}
