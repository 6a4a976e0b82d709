package personal.bookly.core.schedule.domain.model;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;

import java.util.Locale;

/**
 * 날짜별 스태프 일정 예외 유형
 */
public enum OverrideType {
    OFF,           // 해당 날짜 근무 없음
    ADD_HOURS,     // 주간 일정에 시간 추가
    CUSTOM_HOURS;  // 주간 일정을 대체

    public boolean carriesHours() {
        return this != OFF;
    }

    public static OverrideType from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Override type is required");
        }
        try {
            return OverrideType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Invalid override type: " + raw);
        }
    }
}
