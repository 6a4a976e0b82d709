package personal.bookly.core.schedule.domain.exception;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;

import java.time.LocalDate;

/**
 * Duplicate Override Exception
 * 같은 날짜/유형/시간의 예외가 이미 있을 때 (409)
 */
public class DuplicateOverrideException extends BusinessException {
    public DuplicateOverrideException(Long staffId, LocalDate date) {
        super(ErrorCode.DUPLICATE_OVERRIDE,
                String.format("Override already exists: staffId=%d, date=%s", staffId, date));
    }
}
