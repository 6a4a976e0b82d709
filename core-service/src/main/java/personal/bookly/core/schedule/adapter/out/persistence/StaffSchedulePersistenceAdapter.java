package personal.bookly.core.schedule.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.bookly.core.schedule.application.port.out.StaffScheduleOverrideRepository;
import personal.bookly.core.schedule.application.port.out.StaffWeeklyScheduleRepository;
import personal.bookly.core.schedule.domain.model.StaffScheduleOverride;
import personal.bookly.core.schedule.domain.model.StaffWeeklyBlock;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Staff Schedule Persistence Adapter
 * 주간 일정과 날짜별 예외 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StaffSchedulePersistenceAdapter implements StaffWeeklyScheduleRepository, StaffScheduleOverrideRepository {

    private final JpaStaffWeeklyScheduleRepository jpaWeeklyRepository;
    private final JpaStaffScheduleOverrideRepository jpaOverrideRepository;

    @Override
    public List<StaffWeeklyBlock> findByStaff(Long tenantId, Long staffId) {
        return jpaWeeklyRepository.findByTenantIdAndStaffIdOrderByWeekdayAscStartMinuteAsc(tenantId, staffId).stream()
                .map(StaffWeeklyScheduleEntity::toDomain)
                .toList();
    }

    @Override
    public List<StaffWeeklyBlock> findByStaffAndWeekday(Long tenantId, Long staffId, int weekday) {
        return jpaWeeklyRepository.findByTenantIdAndStaffIdAndWeekdayOrderByStartMinuteAsc(tenantId, staffId, weekday).stream()
                .map(StaffWeeklyScheduleEntity::toDomain)
                .toList();
    }

    @Override
    public List<StaffWeeklyBlock> replaceAll(Long tenantId, Long staffId, List<StaffWeeklyBlock> blocks) {
        int deleted = jpaWeeklyRepository.deleteByStaff(tenantId, staffId);
        log.debug("Weekly blocks deleted: tenantId={}, staffId={}, count={}", tenantId, staffId, deleted);

        jpaWeeklyRepository.saveAll(blocks.stream().map(StaffWeeklyScheduleEntity::fromDomain).toList());
        return findByStaff(tenantId, staffId);
    }

    @Override
    public List<StaffScheduleOverride> findByStaffAndDate(Long tenantId, Long staffId, LocalDate date) {
        return jpaOverrideRepository.findByTenantIdAndStaffIdAndOverrideDate(tenantId, staffId, date).stream()
                .map(StaffScheduleOverrideEntity::toDomain)
                .toList();
    }

    @Override
    public List<StaffScheduleOverride> findByStaffAndDateRange(Long tenantId, Long staffId, LocalDate from, LocalDate to) {
        return jpaOverrideRepository.findInRange(tenantId, staffId, from, to).stream()
                .map(StaffScheduleOverrideEntity::toDomain)
                .toList();
    }

    @Override
    public Optional<StaffScheduleOverride> findById(Long tenantId, Long staffId, Long overrideId) {
        return jpaOverrideRepository.findByIdAndTenantIdAndStaffId(overrideId, tenantId, staffId)
                .map(StaffScheduleOverrideEntity::toDomain);
    }

    @Override
    public StaffScheduleOverride save(StaffScheduleOverride override) {
        return jpaOverrideRepository.saveAndFlush(StaffScheduleOverrideEntity.fromDomain(override)).toDomain();
    }

    @Override
    public void delete(StaffScheduleOverride override) {
        jpaOverrideRepository.deleteById(override.id());
    }
}
