package personal.bookly.core.availability.domain.model;

import java.util.Locale;

/**
 * 슬롯 목록이 의도적으로 비어 있는 이유 (오류 아님)
 */
public enum AvailabilityReason {
    STAFF_REQUIRED,
    RESOURCE_REQUIRED,
    TENANT_CLOSED,
    STAFF_UNAVAILABLE;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
