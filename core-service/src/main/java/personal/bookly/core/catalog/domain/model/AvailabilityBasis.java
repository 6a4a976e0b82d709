package personal.bookly.core.catalog.domain.model;

import java.util.Locale;

/**
 * 가용성 판단 기준
 * 어떤 차원(스태프/리소스)의 겹침으로 슬롯 용량을 계산하는지 결정
 */
public enum AvailabilityBasis {
    NONE,
    STAFF,
    RESOURCE,
    BOTH,
    AUTO;

    public boolean includesStaff() {
        return this == STAFF || this == BOTH;
    }

    public boolean includesResource() {
        return this == RESOURCE || this == BOTH;
    }

    /**
     * requires_staff / requires_resource 플래그로부터 기준 도출
     */
    public static AvailabilityBasis derive(boolean requiresStaff, boolean requiresResource) {
        if (requiresStaff && requiresResource) {
            return BOTH;
        }
        if (requiresStaff) {
            return STAFF;
        }
        if (requiresResource) {
            return RESOURCE;
        }
        return NONE;
    }

    public static AvailabilityBasis fromColumn(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        return AvailabilityBasis.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
