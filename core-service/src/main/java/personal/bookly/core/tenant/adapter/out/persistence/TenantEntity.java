package personal.bookly.core.tenant.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.bookly.core.tenant.domain.model.Tenant;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Tenant JPA Entity
 * 테넌트 테이블 매핑 (생성/수정은 외부 관리 화면에서 수행)
 */
@Entity
@Table(name = "tenants")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TenantEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 100)
    private String slug;

    @Column(nullable = false, length = 64)
    private String timezone;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(name = "require_phone", nullable = false)
    private boolean requirePhone;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static TenantEntity fromDomain(Tenant tenant) {
        TenantEntity entity = new TenantEntity();
        entity.id = tenant.id();
        entity.slug = tenant.slug();
        entity.timezone = tenant.zoneId().getId();
        entity.currency = tenant.currency();
        entity.requirePhone = tenant.requirePhone();
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public Tenant toDomain() {
        return new Tenant(id, slug, ZoneId.of(timezone), currency, requirePhone);
    }
}
