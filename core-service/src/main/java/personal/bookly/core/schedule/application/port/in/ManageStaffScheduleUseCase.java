package personal.bookly.core.schedule.application.port.in;

import personal.bookly.core.schedule.domain.model.StaffScheduleOverride;
import personal.bookly.core.schedule.domain.model.StaffWeeklyBlock;

import java.time.LocalDate;
import java.util.List;

/**
 * Manage Staff Schedule UseCase (Input Port)
 * 스태프 주간 일정 및 날짜별 예외 관리
 */
public interface ManageStaffScheduleUseCase {

    List<StaffWeeklyBlock> getWeekly(String tenantSlug, Long staffId);

    List<StaffWeeklyBlock> replaceWeekly(ReplaceWeeklyScheduleCommand command);

    /**
     * @param from null이면 오늘
     * @param to   null이면 from + 30일
     */
    List<StaffScheduleOverride> listOverrides(String tenantSlug, Long staffId, LocalDate from, LocalDate to);

    /**
     * @throws personal.bookly.core.schedule.domain.exception.DuplicateOverrideException 같은 예외가 이미 있을 때 (409)
     */
    StaffScheduleOverride createOverride(CreateOverrideCommand command);

    void deleteOverride(String tenantSlug, Long staffId, Long overrideId);
}
