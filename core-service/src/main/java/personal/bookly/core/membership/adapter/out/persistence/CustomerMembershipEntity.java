package personal.bookly.core.membership.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.bookly.core.membership.domain.model.CustomerMembership;
import personal.bookly.core.membership.domain.model.MembershipStatus;

import java.time.Instant;

/**
 * Customer Membership JPA Entity
 */
@Entity
@Table(name = "customer_memberships")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CustomerMembershipEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Column(name = "customer_id", nullable = false)
    private Long customerId;

    @Column(name = "plan_id")
    private Long planId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private MembershipStatus status;

    @Column(name = "start_at")
    private Instant startAt;

    @Column(name = "end_at")
    private Instant endAt;

    @Column(name = "minutes_remaining", nullable = false)
    private long minutesRemaining;

    @Column(name = "uses_remaining", nullable = false)
    private long usesRemaining;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static CustomerMembershipEntity fromDomain(CustomerMembership membership) {
        CustomerMembershipEntity entity = new CustomerMembershipEntity();
        entity.id = membership.id();
        entity.tenantId = membership.tenantId();
        entity.customerId = membership.customerId();
        entity.planId = membership.planId();
        entity.startAt = membership.startAt();
        entity.createdAt = membership.createdAt();
        entity.apply(membership);
        return entity;
    }

    /**
     * 상태, 종료 시각, 잔액만 변경 가능
     */
    public void apply(CustomerMembership membership) {
        this.status = membership.status();
        this.endAt = membership.endAt();
        this.minutesRemaining = membership.minutesRemaining();
        this.usesRemaining = membership.usesRemaining();
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public CustomerMembership toDomain() {
        return new CustomerMembership(id, tenantId, customerId, planId, status, startAt, endAt,
                minutesRemaining, usesRemaining, createdAt);
    }
}
