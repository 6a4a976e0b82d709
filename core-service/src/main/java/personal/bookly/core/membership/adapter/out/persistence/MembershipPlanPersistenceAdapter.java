package personal.bookly.core.membership.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.bookly.core.membership.application.port.out.MembershipPlanRepository;
import personal.bookly.core.membership.domain.model.MembershipPlan;

import java.util.Optional;

/**
 * Membership Plan Persistence Adapter
 */
@Component
@RequiredArgsConstructor
public class MembershipPlanPersistenceAdapter implements MembershipPlanRepository {

    private final JpaMembershipPlanRepository jpaRepository;

    @Override
    public Optional<MembershipPlan> findByIdAndTenantId(Long planId, Long tenantId) {
        return jpaRepository.findByIdAndTenantId(planId, tenantId)
                .map(MembershipPlanEntity::toDomain);
    }
}
