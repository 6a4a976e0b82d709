package personal.bookly.core.schedule.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.bookly.core.schedule.domain.model.OverrideType;
import personal.bookly.core.schedule.domain.model.StaffScheduleOverride;

import java.time.LocalDate;

/**
 * Staff Schedule Override JPA Entity
 */
@Entity
@Table(name = "staff_schedule_overrides",
        uniqueConstraints = @UniqueConstraint(name = "uk_staff_override",
                columnNames = {"tenant_id", "staff_id", "override_date", "override_type", "start_minute", "end_minute"}))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class StaffScheduleOverrideEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Column(name = "staff_id", nullable = false)
    private Long staffId;

    @Column(name = "override_date", nullable = false)
    private LocalDate overrideDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "override_type", nullable = false, length = 20)
    private OverrideType overrideType;

    @Column(name = "start_minute")
    private Integer startMinute;

    @Column(name = "end_minute")
    private Integer endMinute;

    public static StaffScheduleOverrideEntity fromDomain(StaffScheduleOverride override) {
        StaffScheduleOverrideEntity entity = new StaffScheduleOverrideEntity();
        entity.id = override.id();
        entity.tenantId = override.tenantId();
        entity.staffId = override.staffId();
        entity.overrideDate = override.date();
        entity.overrideType = override.type();
        entity.startMinute = override.startMinute();
        entity.endMinute = override.endMinute();
        return entity;
    }

    public StaffScheduleOverride toDomain() {
        return new StaffScheduleOverride(id, tenantId, staffId, overrideDate, overrideType, startMinute, endMinute);
    }
}
