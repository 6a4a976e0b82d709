package personal.bookly.core.membership.domain.model;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Membership Plan
 * 테넌트가 판매하는 선불 이용권 (분 / 횟수)
 */
public record MembershipPlan(
        Long id,
        Long tenantId,
        String name,
        int includedMinutes,
        int includedUses,
        int validityDays,
        boolean active) {

    public static final int DEFAULT_VALIDITY_DAYS = 30;

    public Instant expiresAt(Instant from) {
        int days = validityDays > 0 ? validityDays : DEFAULT_VALIDITY_DAYS;
        return from.plus(days, ChronoUnit.DAYS);
    }
}
