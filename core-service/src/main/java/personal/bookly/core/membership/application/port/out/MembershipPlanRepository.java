package personal.bookly.core.membership.application.port.out;

import personal.bookly.core.membership.domain.model.MembershipPlan;

import java.util.Optional;

/**
 * Membership Plan Repository (Output Port)
 */
public interface MembershipPlanRepository {

    Optional<MembershipPlan> findByIdAndTenantId(Long planId, Long tenantId);
}
