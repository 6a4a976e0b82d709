package personal.bookly.core.schedule.application.port.in;

import personal.bookly.core.schedule.domain.model.ScheduleResolution;

import java.time.LocalDate;

/**
 * Resolve Staff Schedule UseCase (Input Port)
 */
public interface ResolveStaffScheduleUseCase {

    /**
     * 해당 날짜의 스태프 근무 블록 (영업시간과 교차 전)
     * 스태프 일정 기능이 꺼져 있으면 UNSUPPORTED
     */
    ScheduleResolution resolve(Long tenantId, Long staffId, LocalDate date);
}
