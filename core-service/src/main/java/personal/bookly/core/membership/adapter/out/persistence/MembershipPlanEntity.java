package personal.bookly.core.membership.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.bookly.core.membership.domain.model.MembershipPlan;

/**
 * Membership Plan JPA Entity (읽기 전용)
 */
@Entity
@Table(name = "membership_plans")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class MembershipPlanEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(name = "included_minutes", nullable = false)
    private int includedMinutes;

    @Column(name = "included_uses", nullable = false)
    private int includedUses;

    @Column(name = "validity_days", nullable = false)
    private int validityDays;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    public MembershipPlan toDomain() {
        return new MembershipPlan(id, tenantId, name, includedMinutes, includedUses, validityDays, active);
    }
}
