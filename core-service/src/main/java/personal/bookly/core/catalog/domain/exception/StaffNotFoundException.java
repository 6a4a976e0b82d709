package personal.bookly.core.catalog.domain.exception;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;

/**
 * Staff Not Found Exception
 */
public class StaffNotFoundException extends BusinessException {
    public StaffNotFoundException(Long staffId) {
        super(ErrorCode.STAFF_NOT_FOUND, String.format("Staff not found: staffId=%d", staffId));
    }
}
