package personal.bookly.core.membership.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;
import personal.bookly.core.membership.application.port.in.ConsumeMembershipUseCase;
import personal.bookly.core.membership.application.port.in.ConsumeNextCommand;
import personal.bookly.core.membership.application.port.out.BookingReferencePort;
import personal.bookly.core.membership.application.port.out.CustomerMembershipRepository;
import personal.bookly.core.membership.application.port.out.MembershipLedgerRepository;
import personal.bookly.core.membership.domain.exception.BookingAlreadyDebitedException;
import personal.bookly.core.membership.domain.model.ConsumeOutcome;
import personal.bookly.core.membership.domain.service.MembershipLedgerManager;
import personal.bookly.core.tenant.application.port.in.GetTenantUseCase;
import personal.bookly.core.tenant.domain.model.Tenant;

/**
 * Consume Membership Service
 * Safe Transaction Pattern: 트랜잭션은 MembershipLedgerManager가 담당하고
 * 동시 차감으로 인한 유니크 위반은 트랜잭션 밖에서 멱등 응답으로 변환한다
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConsumeMembershipService implements ConsumeMembershipUseCase {

    private final GetTenantUseCase getTenantUseCase;
    private final BookingReferencePort bookingReferencePort;
    private final MembershipLedgerManager ledgerManager;
    private final MembershipLedgerRepository ledgerRepository;
    private final CustomerMembershipRepository membershipRepository;

    @Override
    public ConsumeOutcome consumeNext(ConsumeNextCommand command) {
        Tenant tenant = getTenantUseCase.getTenant(command.tenantSlug());

        if (!bookingReferencePort.existsInTenant(tenant.id(), command.bookingId())) {
            log.warn("Debit for unknown booking: tenantId={}, bookingId={}", tenant.id(), command.bookingId());
            throw new BusinessException(ErrorCode.INVALID_INPUT, "bookingId must reference a booking of this tenant.");
        }

        try {
            return ledgerManager.consumeNext(tenant.id(), command.customerId(), command.bookingId(),
                    command.minutesToDebit(), command.usesToDebit(), command.noteOrDefault());

        } catch (DataIntegrityViolationException e) {
            // 동시 요청이 먼저 차감한 경우
            log.warn("Concurrent debit detected: tenantId={}, bookingId={}", tenant.id(), command.bookingId());
            return ledgerRepository.findDebitForBooking(tenant.id(), command.bookingId())
                    .flatMap(entry -> membershipRepository.findById(tenant.id(), entry.customerMembershipId()))
                    .map(membership -> new ConsumeOutcome(membership, true))
                    .orElseThrow(() -> new BookingAlreadyDebitedException(command.bookingId()));
        }
    }
}
