package personal.bookly.core.tenant.application.port.in;

import personal.bookly.common.time.TimeWindow;
import personal.bookly.core.tenant.domain.model.TenantHours;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Manage Tenant Hours UseCase (Input Port)
 * 테넌트 주간 영업시간 조회/수정
 */
public interface ManageTenantHoursUseCase {

    /**
     * 일~토 7개 행 반환, 등록되지 않은 요일은 휴무로 채운다
     */
    List<TenantHours> getWeeklyHours(String tenantSlug);

    List<TenantHours> updateWeeklyHours(UpdateTenantHoursCommand command);

    /**
     * 해당 날짜의 영업 창 (휴무이거나 미등록이면 empty)
     */
    Optional<TimeWindow> openWindow(Long tenantId, LocalDate date);
}
