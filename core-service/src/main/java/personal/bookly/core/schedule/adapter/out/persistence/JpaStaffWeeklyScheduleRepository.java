package personal.bookly.core.schedule.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

/**
 * Spring Data JPA Repository for Staff Weekly Schedule
 */
public interface JpaStaffWeeklyScheduleRepository extends JpaRepository<StaffWeeklyScheduleEntity, Long> {

    List<StaffWeeklyScheduleEntity> findByTenantIdAndStaffIdOrderByWeekdayAscStartMinuteAsc(Long tenantId, Long staffId);

    List<StaffWeeklyScheduleEntity> findByTenantIdAndStaffIdAndWeekdayOrderByStartMinuteAsc(Long tenantId, Long staffId, Integer weekday);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from StaffWeeklyScheduleEntity s where s.tenantId = :tenantId and s.staffId = :staffId")
    int deleteByStaff(@Param("tenantId") Long tenantId, @Param("staffId") Long staffId);
}
