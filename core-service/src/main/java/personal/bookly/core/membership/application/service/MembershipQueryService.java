package personal.bookly.core.membership.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.bookly.core.membership.application.port.in.ManageMembershipUseCase;
import personal.bookly.core.membership.application.port.out.CustomerMembershipRepository;
import personal.bookly.core.membership.application.port.out.MembershipLedgerRepository;
import personal.bookly.core.membership.domain.exception.MembershipNotFoundException;
import personal.bookly.core.membership.domain.model.CustomerMembership;
import personal.bookly.core.membership.domain.model.MembershipLedgerEntry;
import personal.bookly.core.tenant.application.port.in.GetTenantUseCase;
import personal.bookly.core.tenant.domain.model.Tenant;

import java.util.List;

/**
 * Membership Query Service
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class MembershipQueryService implements ManageMembershipUseCase {

    private static final int LEDGER_LIMIT = 200;

    private final GetTenantUseCase getTenantUseCase;
    private final CustomerMembershipRepository membershipRepository;
    private final MembershipLedgerRepository ledgerRepository;

    @Override
    public List<CustomerMembership> listByCustomer(String tenantSlug, Long customerId) {
        Tenant tenant = getTenantUseCase.getTenant(tenantSlug);
        return membershipRepository.findByCustomer(tenant.id(), customerId);
    }

    @Override
    public List<MembershipLedgerEntry> getLedger(String tenantSlug, Long membershipId) {
        Tenant tenant = getTenantUseCase.getTenant(tenantSlug);
        requireMembership(tenant.id(), membershipId);
        return ledgerRepository.findByMembership(tenant.id(), membershipId, LEDGER_LIMIT);
    }

    @Override
    @Transactional
    public CustomerMembership archive(String tenantSlug, Long membershipId) {
        Tenant tenant = getTenantUseCase.getTenant(tenantSlug);
        CustomerMembership archived = membershipRepository.save(requireMembership(tenant.id(), membershipId).archive());
        log.info("Membership archived: tenantId={}, membershipId={}", tenant.id(), membershipId);
        return archived;
    }

    private CustomerMembership requireMembership(Long tenantId, Long membershipId) {
        return membershipRepository.findById(tenantId, membershipId)
                .orElseThrow(() -> new MembershipNotFoundException(membershipId));
    }
}
