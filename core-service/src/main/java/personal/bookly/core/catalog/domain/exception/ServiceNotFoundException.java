package personal.bookly.core.catalog.domain.exception;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;

/**
 * Service Not Found Exception
 */
public class ServiceNotFoundException extends BusinessException {
    public ServiceNotFoundException(Long serviceId) {
        super(ErrorCode.SERVICE_NOT_FOUND, String.format("Service not found: serviceId=%d", serviceId));
    }
}
