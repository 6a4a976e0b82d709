package personal.bookly.core.membership.domain.model;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;
import personal.bookly.core.membership.domain.exception.MembershipNotOwnedException;

import java.time.Instant;

/**
 * Customer Membership Domain Model
 * minutesRemaining / usesRemaining 은 원장 합계의 구체화 값이며 직접 수정하지 않는다
 */
public record CustomerMembership(
        Long id,
        Long tenantId,
        Long customerId,
        Long planId,
        MembershipStatus status,
        Instant startAt,
        Instant endAt,
        long minutesRemaining,
        long usesRemaining,
        Instant createdAt) {
    public CustomerMembership {
        if (tenantId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Tenant ID cannot be null");
        }
        if (customerId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Customer ID cannot be null");
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Membership status cannot be null");
        }
    }

    /**
     * 신규 구독 (잔액 0, 부여는 원장 GRANT 항목으로만 반영)
     */
    public static CustomerMembership subscribe(MembershipPlan plan, Long customerId, Instant now) {
        return new CustomerMembership(null, plan.tenantId(), customerId, plan.id(), MembershipStatus.ACTIVE,
                now, plan.expiresAt(now), 0L, 0L, now);
    }

    /**
     * 활성 상태이고 시작됐으며 만료되지 않았는지
     */
    public boolean isUsableAt(Instant now) {
        return status == MembershipStatus.ACTIVE
                && (startAt == null || !startAt.isAfter(now))
                && (endAt == null || endAt.isAfter(now));
    }

    /**
     * 요청 분 또는 요청 횟수를 감당할 수 있는지 (0 이하 요청은 고려하지 않음)
     */
    public boolean covers(int minutes, int uses) {
        return (minutes > 0 && minutesRemaining >= minutes)
                || (uses > 0 && usesRemaining >= uses);
    }

    public boolean isDepleted() {
        return minutesRemaining <= 0 && usesRemaining <= 0;
    }

    public void ensureOwnedBy(Long otherCustomerId) {
        if (!customerId.equals(otherCustomerId)) {
            throw new MembershipNotOwnedException(id);
        }
    }

    public CustomerMembership withBalances(long minutes, long uses) {
        return new CustomerMembership(id, tenantId, customerId, planId, status, startAt, endAt,
                minutes, uses, createdAt);
    }

    /**
     * 잔액 소진으로 만료 (종료 시각이 없으면 지금으로 설정)
     */
    public CustomerMembership expire(Instant now) {
        return new CustomerMembership(id, tenantId, customerId, planId, MembershipStatus.EXPIRED, startAt,
                endAt == null ? now : endAt, minutesRemaining, usesRemaining, createdAt);
    }

    public CustomerMembership archive() {
        return new CustomerMembership(id, tenantId, customerId, planId, MembershipStatus.ARCHIVED, startAt, endAt,
                minutesRemaining, usesRemaining, createdAt);
    }
}
