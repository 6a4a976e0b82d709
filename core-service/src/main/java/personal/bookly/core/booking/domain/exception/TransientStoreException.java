package personal.bookly.core.booking.domain.exception;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;

/**
 * Transient Store Exception
 * 락 대기/쿼리 타임아웃 등 재시도 가능한 저장소 오류 (503)
 */
public class TransientStoreException extends BusinessException {
    public TransientStoreException(String message, Throwable cause) {
        super(ErrorCode.TRANSIENT_STORE_ERROR, message);
        initCause(cause);
    }
}
