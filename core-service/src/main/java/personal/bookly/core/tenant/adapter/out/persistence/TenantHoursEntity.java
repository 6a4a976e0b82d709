package personal.bookly.core.tenant.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.bookly.core.tenant.domain.model.TenantHours;

import java.time.LocalTime;

/**
 * Tenant Hours JPA Entity
 * 테넌트별 요일 영업시간, (tenant_id, day_of_week) 유니크
 */
@Entity
@Table(name = "tenant_hours",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_tenant_hours_day",
                columnNames = {"tenant_id", "day_of_week"}
        ))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TenantHoursEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Column(name = "day_of_week", nullable = false)
    private int dayOfWeek;

    @Column(name = "open_time")
    private LocalTime openTime;

    @Column(name = "close_time")
    private LocalTime closeTime;

    @Column(name = "is_closed", nullable = false)
    private boolean closed;

    public static TenantHoursEntity fromDomain(TenantHours hours) {
        TenantHoursEntity entity = new TenantHoursEntity();
        entity.id = hours.id();
        entity.tenantId = hours.tenantId();
        entity.dayOfWeek = hours.dayOfWeek();
        entity.openTime = hours.openTime();
        entity.closeTime = hours.closeTime();
        entity.closed = hours.closed();
        return entity;
    }

    public TenantHours toDomain() {
        return new TenantHours(id, tenantId, dayOfWeek, openTime, closeTime, closed);
    }
}
