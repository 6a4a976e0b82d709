package personal.bookly.core.catalog.domain.exception;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;

/**
 * Resource Not Found Exception
 */
public class ResourceNotFoundException extends BusinessException {
    public ResourceNotFoundException(Long resourceId) {
        super(ErrorCode.RESOURCE_NOT_FOUND, String.format("Resource not found: resourceId=%d", resourceId));
    }
}
