package personal.bookly.core.schedule.application.port.out;

import personal.bookly.core.schedule.domain.model.StaffWeeklyBlock;

import java.util.List;

/**
 * Staff Weekly Schedule Repository (Output Port)
 */
public interface StaffWeeklyScheduleRepository {

    List<StaffWeeklyBlock> findByStaff(Long tenantId, Long staffId);

    List<StaffWeeklyBlock> findByStaffAndWeekday(Long tenantId, Long staffId, int weekday);

    /**
     * 기존 주간 블록을 모두 삭제하고 새 블록으로 교체
     */
    List<StaffWeeklyBlock> replaceAll(Long tenantId, Long staffId, List<StaffWeeklyBlock> blocks);
}
