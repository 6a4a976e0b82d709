package personal.bookly.core.membership.domain.model;

import java.util.Locale;

/**
 * Customer Membership Status
 */
public enum MembershipStatus {
    ACTIVE,
    EXPIRED,   // 기간 만료 또는 잔액 소진
    ARCHIVED;  // 관리자가 보관 처리

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
