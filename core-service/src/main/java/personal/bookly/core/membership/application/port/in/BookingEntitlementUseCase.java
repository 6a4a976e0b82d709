package personal.bookly.core.membership.application.port.in;

import personal.bookly.core.membership.domain.model.CustomerMembership;
import personal.bookly.core.membership.domain.model.EntitlementDebit;
import personal.bookly.core.membership.domain.model.MembershipRequest;

import java.util.Optional;

/**
 * Booking Entitlement UseCase (Input Port)
 * 예약 생성 트랜잭션에 참여하여 이용권을 잠그고 차감한다
 */
public interface BookingEntitlementUseCase {

    Optional<EntitlementDebit> reserve(Long tenantId, Long customerId, Long serviceId, boolean allowMembership,
                                       MembershipRequest request, int durationMinutes);

    CustomerMembership debitForBooking(Long tenantId, EntitlementDebit debit, Long bookingId);
}
