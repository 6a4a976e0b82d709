package personal.bookly.core.membership.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.bookly.core.customer.application.port.in.ResolveCustomerUseCase;
import personal.bookly.core.membership.application.port.in.SubscribeMembershipCommand;
import personal.bookly.core.membership.application.port.in.SubscribeMembershipUseCase;
import personal.bookly.core.membership.application.port.out.CustomerMembershipRepository;
import personal.bookly.core.membership.application.port.out.MembershipPlanRepository;
import personal.bookly.core.membership.domain.exception.MembershipPlanInactiveException;
import personal.bookly.core.membership.domain.exception.MembershipPlanNotFoundException;
import personal.bookly.core.membership.domain.model.CustomerMembership;
import personal.bookly.core.membership.domain.model.MembershipPlan;
import personal.bookly.core.membership.domain.model.SubscribeOutcome;
import personal.bookly.core.membership.domain.service.MembershipLedgerManager;
import personal.bookly.core.tenant.application.port.in.GetTenantUseCase;
import personal.bookly.core.tenant.domain.model.Tenant;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Membership Subscription Service
 * 같은 플랜의 유효한 이용권이 있으면 그대로 반환, 없으면 생성 후 최초 부여 원장 기록
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MembershipSubscriptionService implements SubscribeMembershipUseCase {

    private final GetTenantUseCase getTenantUseCase;
    private final ResolveCustomerUseCase resolveCustomerUseCase;
    private final MembershipPlanRepository planRepository;
    private final CustomerMembershipRepository membershipRepository;
    private final MembershipLedgerManager ledgerManager;
    private final Clock clock;

    @Override
    @Transactional
    public SubscribeOutcome subscribe(SubscribeMembershipCommand command) {
        Tenant tenant = getTenantUseCase.getTenant(command.tenantSlug());
        resolveCustomerUseCase.getCustomer(tenant.id(), command.customerId());

        MembershipPlan plan = planRepository.findByIdAndTenantId(command.membershipPlanId(), tenant.id())
                .orElseThrow(() -> new MembershipPlanNotFoundException(command.membershipPlanId()));
        if (!plan.active()) {
            throw new MembershipPlanInactiveException(plan.id());
        }

        Instant now = clock.instant();
        Optional<CustomerMembership> existing = membershipRepository
                .findActiveByPlan(tenant.id(), command.customerId(), plan.id())
                .filter(m -> m.isUsableAt(now));
        if (existing.isPresent()) {
            log.info("Membership already active: tenantId={}, customerId={}, planId={}, membershipId={}",
                    tenant.id(), command.customerId(), plan.id(), existing.get().id());
            return new SubscribeOutcome(existing.get(), true);
        }

        CustomerMembership created = membershipRepository.save(
                CustomerMembership.subscribe(plan, command.customerId(), now));
        CustomerMembership granted = ledgerManager.grantInitial(created, plan);

        log.info("Membership subscribed: tenantId={}, customerId={}, planId={}, membershipId={}",
                tenant.id(), command.customerId(), plan.id(), granted.id());
        return new SubscribeOutcome(granted, false);
    }
}
