package personal.bookly.core.booking.domain.model;

import personal.bookly.core.customer.domain.model.Customer;
import personal.bookly.core.membership.domain.model.MembershipRequest;

import java.time.Instant;

/**
 * 검증이 끝난 예약 생성 요청
 * 트랜잭션 안에서 잠금/재검사 후 Booking으로 저장된다
 */
public record BookingDraft(
        Long tenantId,
        Long serviceId,
        Long staffId,
        Long resourceId,
        Customer customer,
        Instant startTime,
        int durationMinutes,
        int capacity,
        boolean requiresConfirmation,
        boolean allowMembership,
        String idempotencyKey,
        MembershipRequest membershipRequest) {

    public Instant endTime() {
        return startTime.plusSeconds(durationMinutes * 60L);
    }

    public boolean hasIdempotencyKey() {
        return idempotencyKey != null;
    }
}
