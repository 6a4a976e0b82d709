package personal.bookly.common.exception;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 에러 응답 본문
 * { "code": "B003", "error": "...", "conflicts": [...] } 형태로 직렬화
 * details의 각 항목은 최상위 필드로 펼쳐진다
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    @Getter
    private final String code;
    @Getter
    private final String error;
    private final Map<String, Object> details;

    private ErrorResponse(String code, String error, Map<String, Object> details) {
        this.code = code;
        this.error = error;
        this.details = details;
    }

    public static ErrorResponse of(ErrorCode errorCode, String message) {
        return new ErrorResponse(errorCode.getCode(), message, Collections.emptyMap());
    }

    public static ErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details) {
        return new ErrorResponse(errorCode.getCode(), message,
                details == null ? Collections.emptyMap() : new LinkedHashMap<>(details));
    }

    @JsonAnyGetter
    public Map<String, Object> details() {
        return details;
    }
}
