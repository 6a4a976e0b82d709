package personal.bookly.core.membership.application.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import personal.bookly.core.membership.application.port.in.BookingEntitlementUseCase;
import personal.bookly.core.membership.domain.model.CustomerMembership;
import personal.bookly.core.membership.domain.model.EntitlementDebit;
import personal.bookly.core.membership.domain.model.MembershipRequest;
import personal.bookly.core.membership.domain.service.MembershipLedgerManager;

import java.util.Optional;

/**
 * Booking Entitlement Service
 * 예약 트랜잭션 안에서만 호출된다 (MANDATORY)
 */
@Service
@RequiredArgsConstructor
@Transactional(propagation = Propagation.MANDATORY)
public class BookingEntitlementService implements BookingEntitlementUseCase {

    private final MembershipLedgerManager ledgerManager;

    @Override
    public Optional<EntitlementDebit> reserve(Long tenantId, Long customerId, Long serviceId, boolean allowMembership,
                                              MembershipRequest request, int durationMinutes) {
        return ledgerManager.reserveForBooking(tenantId, customerId, serviceId, allowMembership, request, durationMinutes);
    }

    @Override
    public CustomerMembership debitForBooking(Long tenantId, EntitlementDebit debit, Long bookingId) {
        return ledgerManager.recordDebit(tenantId, debit, bookingId, "Debit for booking " + bookingId);
    }
}
