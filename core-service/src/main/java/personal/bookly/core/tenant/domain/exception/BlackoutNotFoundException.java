package personal.bookly.core.tenant.domain.exception;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;

/**
 * Blackout Not Found Exception
 */
public class BlackoutNotFoundException extends BusinessException {
    public BlackoutNotFoundException(Long blackoutId) {
        super(ErrorCode.BLACKOUT_NOT_FOUND, String.format("Blackout not found: blackoutId=%d", blackoutId));
    }
}
