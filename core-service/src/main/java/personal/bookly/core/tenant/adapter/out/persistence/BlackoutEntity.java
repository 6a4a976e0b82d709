package personal.bookly.core.tenant.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.bookly.core.tenant.domain.model.Blackout;

import java.time.Instant;

/**
 * Blackout JPA Entity
 * 삭제 대신 is_active=false 로 비활성화
 */
@Entity
@Table(name = "blackouts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BlackoutEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Column(name = "resource_id")
    private Long resourceId;

    @Column(name = "staff_id")
    private Long staffId;

    @Column(name = "service_id")
    private Long serviceId;

    @Column(name = "starts_at", nullable = false)
    private Instant startsAt;

    @Column(name = "ends_at", nullable = false)
    private Instant endsAt;

    @Column(length = 255)
    private String reason;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static BlackoutEntity fromDomain(Blackout blackout) {
        BlackoutEntity entity = new BlackoutEntity();
        entity.id = blackout.id();
        entity.tenantId = blackout.tenantId();
        entity.resourceId = blackout.resourceId();
        entity.staffId = blackout.staffId();
        entity.serviceId = blackout.serviceId();
        entity.startsAt = blackout.startsAt();
        entity.endsAt = blackout.endsAt();
        entity.reason = blackout.reason();
        entity.active = blackout.active();
        entity.createdAt = blackout.createdAt();
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public Blackout toDomain() {
        return new Blackout(id, tenantId, resourceId, staffId, serviceId,
                startsAt, endsAt, reason, active, createdAt);
    }
}
