package personal.bookly.core.membership.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

/**
 * Spring Data JPA Repository for Membership Plan
 */
public interface JpaMembershipPlanRepository extends JpaRepository<MembershipPlanEntity, Long> {

    Optional<MembershipPlanEntity> findByIdAndTenantId(Long id, Long tenantId);
}
