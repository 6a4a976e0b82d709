package personal.bookly.core.schedule.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA Repository for Staff Schedule Override
 */
public interface JpaStaffScheduleOverrideRepository extends JpaRepository<StaffScheduleOverrideEntity, Long> {

    List<StaffScheduleOverrideEntity> findByTenantIdAndStaffIdAndOverrideDate(Long tenantId, Long staffId, LocalDate overrideDate);

    @Query("""
            select o from StaffScheduleOverrideEntity o
            where o.tenantId = :tenantId
              and o.staffId = :staffId
              and o.overrideDate between :from and :to
            order by o.overrideDate asc, o.startMinute asc nulls first, o.id asc
            """)
    List<StaffScheduleOverrideEntity> findInRange(@Param("tenantId") Long tenantId,
                                                  @Param("staffId") Long staffId,
                                                  @Param("from") LocalDate from,
                                                  @Param("to") LocalDate to);

    Optional<StaffScheduleOverrideEntity> findByIdAndTenantIdAndStaffId(Long id, Long tenantId, Long staffId);
}
