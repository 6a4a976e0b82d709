package personal.bookly.core.schedule.application.port.out;

import personal.bookly.core.schedule.domain.model.StaffScheduleOverride;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Staff Schedule Override Repository (Output Port)
 */
public interface StaffScheduleOverrideRepository {

    List<StaffScheduleOverride> findByStaffAndDate(Long tenantId, Long staffId, LocalDate date);

    /**
     * [from, to] 범위 (양 끝 포함)
     */
    List<StaffScheduleOverride> findByStaffAndDateRange(Long tenantId, Long staffId, LocalDate from, LocalDate to);

    Optional<StaffScheduleOverride> findById(Long tenantId, Long staffId, Long overrideId);

    StaffScheduleOverride save(StaffScheduleOverride override);

    void delete(StaffScheduleOverride override);
}
