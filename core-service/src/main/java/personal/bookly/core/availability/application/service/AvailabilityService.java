package personal.bookly.core.availability.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.bookly.common.time.TimeWindow;
import personal.bookly.core.availability.application.port.in.AvailabilityQuery;
import personal.bookly.core.availability.application.port.in.GetAvailabilityUseCase;
import personal.bookly.core.availability.application.port.out.BusyIntervalPort;
import personal.bookly.core.availability.domain.model.AvailabilityMeta;
import personal.bookly.core.availability.domain.model.AvailabilityReason;
import personal.bookly.core.availability.domain.model.DayAvailability;
import personal.bookly.core.availability.domain.model.Occupancy;
import personal.bookly.core.availability.domain.model.OccupiedSpan;
import personal.bookly.core.availability.domain.model.ScheduleSource;
import personal.bookly.core.availability.domain.model.Slot;
import personal.bookly.core.availability.domain.model.SlotGrid;
import personal.bookly.core.availability.domain.service.SlotCalculator;
import personal.bookly.core.catalog.application.port.in.GetCatalogUseCase;
import personal.bookly.core.catalog.domain.model.AvailabilityBasis;
import personal.bookly.core.catalog.domain.model.BookableService;
import personal.bookly.core.schedule.application.port.in.ResolveStaffScheduleUseCase;
import personal.bookly.core.schedule.domain.model.ScheduleResolution;
import personal.bookly.core.schedule.domain.service.ScheduleResolver;
import personal.bookly.core.tenant.application.port.in.CheckBlackoutUseCase;
import personal.bookly.core.tenant.application.port.in.GetTenantUseCase;
import personal.bookly.core.tenant.application.port.in.ManageTenantHoursUseCase;
import personal.bookly.core.tenant.domain.model.Tenant;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Availability Service
 * 영업시간, 스태프 일정, 기존 예약, 블랙아웃을 합쳐 하루치 슬롯을 계산
 *
 * <p>흐름: 테넌트/서비스 조회 → 기준별 필수 값 확인 → 영업 창 → (스태프 기준) 근무 블록 교차
 * → 점유 구간/블랙아웃 조회 → 슬롯 계산
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class AvailabilityService implements GetAvailabilityUseCase {

    private final GetTenantUseCase getTenantUseCase;
    private final GetCatalogUseCase getCatalogUseCase;
    private final ManageTenantHoursUseCase manageTenantHoursUseCase;
    private final ResolveStaffScheduleUseCase resolveStaffScheduleUseCase;
    private final ScheduleResolver scheduleResolver;
    private final CheckBlackoutUseCase checkBlackoutUseCase;
    private final BusyIntervalPort busyIntervalPort;
    private final SlotCalculator slotCalculator;

    @Override
    public DayAvailability getAvailability(AvailabilityQuery query) {
        Tenant tenant = getTenantUseCase.getTenant(query.tenantSlug());
        BookableService service = getCatalogUseCase.getService(tenant.id(), query.serviceId());
        AvailabilityBasis basis = service.effectiveBasis();

        if (basis.includesStaff() && query.staffId() == null) {
            return empty(service, AvailabilityReason.STAFF_REQUIRED, ScheduleSource.TENANT_HOURS);
        }
        if (basis.includesResource() && query.resourceId() == null) {
            return empty(service, AvailabilityReason.RESOURCE_REQUIRED, ScheduleSource.TENANT_HOURS);
        }

        // 존재하지 않거나 다른 테넌트 소속이면 404
        if (query.staffId() != null) {
            getCatalogUseCase.getStaff(tenant.id(), query.staffId());
        }
        if (query.resourceId() != null) {
            getCatalogUseCase.getResource(tenant.id(), query.resourceId());
        }

        Optional<TimeWindow> openWindow = manageTenantHoursUseCase.openWindow(tenant.id(), query.date());
        if (openWindow.isEmpty()) {
            return empty(service, AvailabilityReason.TENANT_CLOSED, ScheduleSource.TENANT_HOURS);
        }

        List<TimeWindow> windows = List.of(openWindow.get());
        ScheduleSource source = ScheduleSource.TENANT_HOURS;

        if (basis.includesStaff()) {
            ScheduleResolution resolution = resolveStaffScheduleUseCase.resolve(
                    tenant.id(), query.staffId(), query.date());
            if (resolution.isUnsupported()) {
                source = ScheduleSource.TENANT_HOURS_FALLBACK;
            } else {
                source = ScheduleSource.STAFF_SCHEDULE;
                windows = scheduleResolver.intersectWithOpenWindow(resolution.blocks(), openWindow.get());
                if (windows.isEmpty()) {
                    return empty(service, AvailabilityReason.STAFF_UNAVAILABLE, source);
                }
            }
        }

        SlotGrid grid = new SlotGrid(query.date(), tenant.zoneId(), windows,
                service.stepMinutes(), service.durationMinutes(), service.capacity());
        Occupancy occupancy = loadOccupancy(tenant.id(), service.id(), query, grid);
        List<Slot> slots = slotCalculator.calculate(grid, occupancy);

        log.debug("Availability computed: tenant={}, serviceId={}, date={}, basis={}, source={}, slots={}",
                tenant.slug(), service.id(), query.date(), basis.value(), source.value(), slots.size());

        return new DayAvailability(slots, meta(service, null, source));
    }

    private Occupancy loadOccupancy(Long tenantId, Long serviceId, AvailabilityQuery query, SlotGrid grid) {
        Instant from = grid.rangeStart();
        Instant to = grid.rangeEnd();

        List<OccupiedSpan> byStaff = query.staffId() == null ? null
                : busyIntervalPort.findByStaff(tenantId, query.staffId(), from, to);
        List<OccupiedSpan> byResource = query.resourceId() == null ? null
                : busyIntervalPort.findByResource(tenantId, query.resourceId(), from, to);
        List<OccupiedSpan> byService = byStaff == null && byResource == null
                ? busyIntervalPort.findByService(tenantId, serviceId, from, to)
                : null;

        List<OccupiedSpan> blackouts = checkBlackoutUseCase
                .findBlocking(tenantId, from, to, serviceId, query.staffId(), query.resourceId())
                .stream()
                .map(blackout -> new OccupiedSpan(blackout.startsAt(), blackout.endsAt()))
                .toList();

        return new Occupancy(byService, byStaff, byResource, blackouts);
    }

    private DayAvailability empty(BookableService service, AvailabilityReason reason, ScheduleSource source) {
        log.debug("Availability empty: serviceId={}, reason={}", service.id(), reason.value());
        return DayAvailability.empty(meta(service, reason, source));
    }

    private AvailabilityMeta meta(BookableService service, AvailabilityReason reason, ScheduleSource source) {
        return new AvailabilityMeta(
                service.durationMinutes(),
                service.stepMinutes(),
                service.capacity(),
                service.effectiveBasis(),
                reason,
                source);
    }
}
