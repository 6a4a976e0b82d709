package personal.bookly.core.tenant.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.bookly.common.time.SlotMath;
import personal.bookly.common.time.TimeWindow;
import personal.bookly.core.tenant.application.port.in.GetTenantUseCase;
import personal.bookly.core.tenant.application.port.in.ManageTenantHoursUseCase;
import personal.bookly.core.tenant.application.port.in.UpdateTenantHoursCommand;
import personal.bookly.core.tenant.application.port.out.TenantHoursRepository;
import personal.bookly.core.tenant.domain.model.Tenant;
import personal.bookly.core.tenant.domain.model.TenantHours;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Tenant Hours Service
 * 주간 영업시간 조회/수정과 날짜별 영업 창 계산
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class TenantHoursService implements ManageTenantHoursUseCase {

    private final GetTenantUseCase getTenantUseCase;
    private final TenantHoursRepository tenantHoursRepository;

    @Override
    public List<TenantHours> getWeeklyHours(String tenantSlug) {
        Tenant tenant = getTenantUseCase.getTenant(tenantSlug);
        return fillWeek(tenant.id(), tenantHoursRepository.findByTenantId(tenant.id()));
    }

    @Override
    @Transactional
    public List<TenantHours> updateWeeklyHours(UpdateTenantHoursCommand command) {
        Tenant tenant = getTenantUseCase.getTenant(command.tenantSlug());

        for (UpdateTenantHoursCommand.DayHours day : command.days()) {
            LocalTime open = day.closed() ? null : SlotMath.toLocalTime(SlotMath.parseClockTime(day.openTime()));
            LocalTime close = day.closed() ? null : SlotMath.toLocalTime(SlotMath.parseClockTime(day.closeTime()));

            TenantHours hours = tenantHoursRepository.findByTenantIdAndDayOfWeek(tenant.id(), day.dayOfWeek())
                    .map(existing -> existing.update(open, close, day.closed()))
                    .orElseGet(() -> new TenantHours(null, tenant.id(), day.dayOfWeek(), open, close, day.closed()));
            tenantHoursRepository.save(hours);
        }

        log.info("Tenant hours updated: tenantId={}, days={}", tenant.id(), command.days().size());
        return fillWeek(tenant.id(), tenantHoursRepository.findByTenantId(tenant.id()));
    }

    @Override
    public Optional<TimeWindow> openWindow(Long tenantId, LocalDate date) {
        return tenantHoursRepository.findByTenantIdAndDayOfWeek(tenantId, TenantHours.dayIndexOf(date))
                .flatMap(TenantHours::window);
    }

    private List<TenantHours> fillWeek(Long tenantId, List<TenantHours> stored) {
        Map<Integer, TenantHours> byDay = stored.stream()
                .collect(Collectors.toMap(TenantHours::dayOfWeek, Function.identity(), (a, b) -> a));
        List<TenantHours> week = new ArrayList<>(7);
        for (int day = 0; day < 7; day++) {
            week.add(byDay.getOrDefault(day, TenantHours.closedDay(tenantId, day)));
        }
        return week;
    }
}
