package personal.bookly.core.schedule.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.bookly.core.schedule.domain.model.StaffWeeklyBlock;

/**
 * Staff Weekly Schedule JPA Entity
 */
@Entity
@Table(name = "staff_weekly_schedules")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class StaffWeeklyScheduleEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Column(name = "staff_id", nullable = false)
    private Long staffId;

    @Column(nullable = false)
    private Integer weekday;

    @Column(name = "start_minute", nullable = false)
    private Integer startMinute;

    @Column(name = "end_minute", nullable = false)
    private Integer endMinute;

    public static StaffWeeklyScheduleEntity fromDomain(StaffWeeklyBlock block) {
        StaffWeeklyScheduleEntity entity = new StaffWeeklyScheduleEntity();
        entity.id = block.id();
        entity.tenantId = block.tenantId();
        entity.staffId = block.staffId();
        entity.weekday = block.weekday();
        entity.startMinute = block.startMinute();
        entity.endMinute = block.endMinute();
        return entity;
    }

    public StaffWeeklyBlock toDomain() {
        return new StaffWeeklyBlock(id, tenantId, staffId, weekday, startMinute, endMinute);
    }
}
