package personal.bookly.core.schedule.domain.exception;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;

public class OverrideNotFoundException extends BusinessException {
    public OverrideNotFoundException(Long overrideId) {
        super(ErrorCode.OVERRIDE_NOT_FOUND, String.format("Override not found: overrideId=%d", overrideId));
    }
}
