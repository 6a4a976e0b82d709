package personal.bookly.common.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.Map;

/**
 * 비즈니스 예외 최상위 클래스
 * ErrorCode로 HTTP 상태와 응답 코드를 결정하고, details는 응답 본문에 그대로 노출된다
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    public BusinessException(ErrorCode errorCode) {
        this(errorCode, errorCode.getMessage());
    }

    public BusinessException(ErrorCode errorCode, String message) {
        this(errorCode, message, Collections.emptyMap());
    }

    public BusinessException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(message);
        this.errorCode = errorCode;
        this.details = details == null ? Collections.emptyMap() : details;
    }
}
