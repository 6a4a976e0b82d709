package personal.bookly.core.membership.adapter.out.persistence;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import personal.bookly.core.membership.domain.model.MembershipStatus;

import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA Repository for Customer Membership
 */
public interface JpaCustomerMembershipRepository extends JpaRepository<CustomerMembershipEntity, Long> {

    Optional<CustomerMembershipEntity> findByIdAndTenantId(Long id, Long tenantId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000"))
    @Query("select m from CustomerMembershipEntity m where m.id = :id and m.tenantId = :tenantId")
    Optional<CustomerMembershipEntity> findByIdForUpdate(@Param("tenantId") Long tenantId, @Param("id") Long id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000"))
    @Query("""
            select m from CustomerMembershipEntity m
            where m.tenantId = :tenantId and m.customerId = :customerId and m.status = :status
            order by m.id
            """)
    List<CustomerMembershipEntity> findByStatusForUpdate(@Param("tenantId") Long tenantId,
                                                         @Param("customerId") Long customerId,
                                                         @Param("status") MembershipStatus status);

    List<CustomerMembershipEntity> findByTenantIdAndCustomerIdAndPlanIdAndStatusOrderByIdDesc(
            Long tenantId, Long customerId, Long planId, MembershipStatus status);

    List<CustomerMembershipEntity> findByTenantIdAndCustomerIdOrderByIdDesc(Long tenantId, Long customerId);
}
