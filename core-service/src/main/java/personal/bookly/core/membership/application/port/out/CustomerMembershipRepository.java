package personal.bookly.core.membership.application.port.out;

import personal.bookly.core.membership.domain.model.CustomerMembership;

import java.util.List;
import java.util.Optional;

/**
 * Customer Membership Repository (Output Port)
 */
public interface CustomerMembershipRepository {

    Optional<CustomerMembership> findById(Long tenantId, Long membershipId);

    /**
     * 비관적 락 (PESSIMISTIC_WRITE)
     */
    Optional<CustomerMembership> findByIdForUpdate(Long tenantId, Long membershipId);

    /**
     * 고객의 ACTIVE 이용권을 id 순으로 잠그고 조회
     * 잠금 순서를 고정해 교착 상태를 피한다
     */
    List<CustomerMembership> findActiveForUpdate(Long tenantId, Long customerId);

    Optional<CustomerMembership> findActiveByPlan(Long tenantId, Long customerId, Long planId);

    List<CustomerMembership> findByCustomer(Long tenantId, Long customerId);

    CustomerMembership save(CustomerMembership membership);
}
