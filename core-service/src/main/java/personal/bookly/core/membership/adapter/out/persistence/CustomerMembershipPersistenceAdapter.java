package personal.bookly.core.membership.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.bookly.core.membership.application.port.out.CustomerMembershipRepository;
import personal.bookly.core.membership.domain.model.CustomerMembership;
import personal.bookly.core.membership.domain.model.MembershipStatus;

import java.util.List;
import java.util.Optional;

/**
 * Customer Membership Persistence Adapter
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CustomerMembershipPersistenceAdapter implements CustomerMembershipRepository {

    private final JpaCustomerMembershipRepository jpaRepository;

    @Override
    public Optional<CustomerMembership> findById(Long tenantId, Long membershipId) {
        return jpaRepository.findByIdAndTenantId(membershipId, tenantId)
                .map(CustomerMembershipEntity::toDomain);
    }

    @Override
    public Optional<CustomerMembership> findByIdForUpdate(Long tenantId, Long membershipId) {
        log.debug("Locking membership row: tenantId={}, membershipId={}", tenantId, membershipId);
        return jpaRepository.findByIdForUpdate(tenantId, membershipId)
                .map(CustomerMembershipEntity::toDomain);
    }

    @Override
    public List<CustomerMembership> findActiveForUpdate(Long tenantId, Long customerId) {
        log.debug("Locking active memberships: tenantId={}, customerId={}", tenantId, customerId);
        return jpaRepository.findByStatusForUpdate(tenantId, customerId, MembershipStatus.ACTIVE).stream()
                .map(CustomerMembershipEntity::toDomain)
                .toList();
    }

    @Override
    public Optional<CustomerMembership> findActiveByPlan(Long tenantId, Long customerId, Long planId) {
        return jpaRepository.findByTenantIdAndCustomerIdAndPlanIdAndStatusOrderByIdDesc(
                        tenantId, customerId, planId, MembershipStatus.ACTIVE).stream()
                .findFirst()
                .map(CustomerMembershipEntity::toDomain);
    }

    @Override
    public List<CustomerMembership> findByCustomer(Long tenantId, Long customerId) {
        return jpaRepository.findByTenantIdAndCustomerIdOrderByIdDesc(tenantId, customerId).stream()
                .map(CustomerMembershipEntity::toDomain)
                .toList();
    }

    @Override
    public CustomerMembership save(CustomerMembership membership) {
        if (membership.id() == null) {
            return jpaRepository.saveAndFlush(CustomerMembershipEntity.fromDomain(membership)).toDomain();
        }
        CustomerMembershipEntity entity = jpaRepository.findById(membership.id())
                .orElseGet(() -> CustomerMembershipEntity.fromDomain(membership));
        entity.apply(membership);
        return jpaRepository.save(entity).toDomain();
    }
}
