package personal.bookly.core.availability.domain.model;

import java.util.Locale;

/**
 * 슬롯 창을 만든 근거
 */
public enum ScheduleSource {
    /**
     * 테넌트 영업시간
     */
    TENANT_HOURS,

    /**
     * 스태프 근무 일정 ∩ 영업시간
     */
    STAFF_SCHEDULE,

    /**
     * 스태프 일정 미지원으로 영업시간 사용
     */
    TENANT_HOURS_FALLBACK;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
