package personal.bookly.core.membership.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;
import personal.bookly.core.membership.application.port.out.CustomerMembershipRepository;
import personal.bookly.core.membership.application.port.out.MembershipLedgerRepository;
import personal.bookly.core.membership.domain.exception.InsufficientMembershipBalanceException;
import personal.bookly.core.membership.domain.exception.MembershipNotAllowedException;
import personal.bookly.core.membership.domain.exception.MembershipNotFoundException;
import personal.bookly.core.membership.domain.exception.MembershipNotUsableException;
import personal.bookly.core.membership.domain.exception.NoEligibleEntitlementException;
import personal.bookly.core.membership.domain.model.ConsumeOutcome;
import personal.bookly.core.membership.domain.model.CustomerMembership;
import personal.bookly.core.membership.domain.model.EntitlementDebit;
import personal.bookly.core.membership.domain.model.LedgerBalance;
import personal.bookly.core.membership.domain.model.MembershipLedgerEntry;
import personal.bookly.core.membership.domain.model.MembershipPlan;
import personal.bookly.core.membership.domain.model.MembershipRequest;
import personal.bookly.core.membership.domain.model.MembershipStatus;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Membership Ledger Manager
 * 원장 기록과 잔액 재계산을 한 트랜잭션 안에서 수행
 * 잔액(minutes_remaining, uses_remaining)은 원장 합계로만 갱신한다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MembershipLedgerManager {

    private final CustomerMembershipRepository membershipRepository;
    private final MembershipLedgerRepository ledgerRepository;
    private final EntitlementSelector entitlementSelector;
    private final DebitPolicy debitPolicy;
    private final Clock clock;

    /**
     * 예약 생성 트랜잭션 안에서 차감할 이용권을 잠그고 결정
     * 소프트 요청(autoConsume)은 대상이 없으면 빈 값을 반환하고 예약은 이용권 없이 진행된다
     *
     * @return 차감 예정 내역, 이용권을 사용하지 않으면 empty
     */
    @Transactional
    public Optional<EntitlementDebit> reserveForBooking(Long tenantId, Long customerId, Long serviceId,
                                                        boolean allowMembership, MembershipRequest request,
                                                        int durationMinutes) {
        if (request == null || !request.isRequested()) {
            return Optional.empty();
        }
        if (!allowMembership) {
            if (request.isHard()) {
                log.warn("Membership use not allowed: tenantId={}, serviceId={}", tenantId, serviceId);
                throw new MembershipNotAllowedException(serviceId);
            }
            return Optional.empty();
        }

        Instant now = clock.instant();

        if (request.isExplicit()) {
            CustomerMembership membership = membershipRepository
                    .findByIdForUpdate(tenantId, request.customerMembershipId())
                    .orElseThrow(() -> new BusinessException(ErrorCode.INVALID_INPUT,
                            "Unknown customer membership."));
            membership.ensureOwnedBy(customerId);
            if (!membership.isUsableAt(now)) {
                throw new MembershipNotUsableException(membership.id());
            }
            return Optional.of(debitPolicy.forBooking(membership, durationMinutes)
                    .orElseThrow(() -> new InsufficientMembershipBalanceException(membership.id())));
        }

        List<CustomerMembership> candidates = membershipRepository.findActiveForUpdate(tenantId, customerId);
        Optional<EntitlementDebit> debit = entitlementSelector.select(candidates, durationMinutes, 1, now)
                .flatMap(selected -> debitPolicy.forBooking(selected, durationMinutes));

        if (debit.isEmpty() && request.required()) {
            log.warn("No eligible membership for required booking: tenantId={}, customerId={}", tenantId, customerId);
            throw new NoEligibleEntitlementException();
        }
        return debit;
    }

    /**
     * 차감 원장 기록 후 잔액 재계산
     */
    @Transactional
    public CustomerMembership recordDebit(Long tenantId, EntitlementDebit debit, Long bookingId, String note) {
        Instant now = clock.instant();
        ledgerRepository.append(MembershipLedgerEntry.debit(tenantId, debit, bookingId, note, now));
        log.info("Membership debited: tenantId={}, membershipId={}, bookingId={}, minutes={}, uses={}",
                tenantId, debit.membershipId(), bookingId, debit.minutesDelta(), debit.usesDelta());
        return recomputeBalances(tenantId, debit.membershipId(), now, true);
    }

    /**
     * 요청량을 감당하는 이용권을 골라 그대로 차감
     * 같은 예약에 대한 차감이 이미 있으면 현재 이용권 상태만 반환
     */
    @Transactional
    public ConsumeOutcome consumeNext(Long tenantId, Long customerId, Long bookingId,
                                      int minutesToDebit, int usesToDebit, String note) {
        // 잠금 이후에 기존 차감을 확인해야 동시 요청이 다른 이용권을 차감하지 않는다
        List<CustomerMembership> candidates = membershipRepository.findActiveForUpdate(tenantId, customerId);

        Optional<MembershipLedgerEntry> existing = ledgerRepository.findDebitForBooking(tenantId, bookingId);
        if (existing.isPresent()) {
            log.info("Booking already debited: tenantId={}, bookingId={}", tenantId, bookingId);
            return new ConsumeOutcome(currentMembership(tenantId, existing.get().customerMembershipId()), true);
        }

        CustomerMembership selected = entitlementSelector
                .select(candidates, minutesToDebit, usesToDebit, clock.instant())
                .orElseThrow(() -> {
                    log.warn("No eligible membership: tenantId={}, customerId={}, minutes={}, uses={}",
                            tenantId, customerId, minutesToDebit, usesToDebit);
                    return new NoEligibleEntitlementException();
                });

        EntitlementDebit debit = new EntitlementDebit(selected.id(), -minutesToDebit, -usesToDebit);
        return new ConsumeOutcome(recordDebit(tenantId, debit, bookingId, note), false);
    }

    /**
     * 플랜 구독 시 최초 부여
     */
    @Transactional
    public CustomerMembership grantInitial(CustomerMembership membership, MembershipPlan plan) {
        Instant now = clock.instant();
        ledgerRepository.append(MembershipLedgerEntry.grant(membership, plan, now));
        return recomputeBalances(membership.tenantId(), membership.id(), now, false);
    }

    /**
     * @param expireWhenDepleted 차감 후에만 소진 만료를 적용 (빈 플랜 부여는 만료시키지 않음)
     */
    private CustomerMembership recomputeBalances(Long tenantId, Long membershipId, Instant now,
                                                 boolean expireWhenDepleted) {
        CustomerMembership membership = currentMembership(tenantId, membershipId);
        LedgerBalance balance = ledgerRepository.sumByMembership(membershipId);
        if (balance.isNegative()) {
            log.warn("Ledger balance would go negative: membershipId={}, minutes={}, uses={}",
                    membershipId, balance.minutes(), balance.uses());
            throw new InsufficientMembershipBalanceException(membershipId);
        }

        CustomerMembership updated = membership.withBalances(balance.minutes(), balance.uses());
        if (expireWhenDepleted && updated.status() == MembershipStatus.ACTIVE && updated.isDepleted()) {
            updated = updated.expire(now);
            log.info("Membership depleted: membershipId={}", membershipId);
        }
        return membershipRepository.save(updated);
    }

    private CustomerMembership currentMembership(Long tenantId, Long membershipId) {
        return membershipRepository.findById(tenantId, membershipId)
                .orElseThrow(() -> new MembershipNotFoundException(membershipId));
    }
}
