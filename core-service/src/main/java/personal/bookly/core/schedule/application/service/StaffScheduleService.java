package personal.bookly.core.schedule.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.bookly.core.catalog.application.port.in.GetCatalogUseCase;
import personal.bookly.core.config.BooklyProperties;
import personal.bookly.core.schedule.application.port.in.CreateOverrideCommand;
import personal.bookly.core.schedule.application.port.in.ManageStaffScheduleUseCase;
import personal.bookly.core.schedule.application.port.in.ReplaceWeeklyScheduleCommand;
import personal.bookly.core.schedule.application.port.in.ResolveStaffScheduleUseCase;
import personal.bookly.core.schedule.application.port.out.StaffScheduleOverrideRepository;
import personal.bookly.core.schedule.application.port.out.StaffWeeklyScheduleRepository;
import personal.bookly.core.schedule.domain.exception.DuplicateOverrideException;
import personal.bookly.core.schedule.domain.exception.OverrideNotFoundException;
import personal.bookly.core.schedule.domain.model.ScheduleResolution;
import personal.bookly.core.schedule.domain.model.StaffScheduleOverride;
import personal.bookly.core.schedule.domain.model.StaffWeeklyBlock;
import personal.bookly.core.schedule.domain.service.ScheduleResolver;
import personal.bookly.core.tenant.application.port.in.GetTenantUseCase;
import personal.bookly.core.tenant.domain.model.Tenant;
import personal.bookly.core.tenant.domain.model.TenantHours;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Staff Schedule Service
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class StaffScheduleService implements ResolveStaffScheduleUseCase, ManageStaffScheduleUseCase {

    private static final int DEFAULT_OVERRIDE_RANGE_DAYS = 30;

    private final GetTenantUseCase getTenantUseCase;
    private final GetCatalogUseCase getCatalogUseCase;
    private final StaffWeeklyScheduleRepository weeklyScheduleRepository;
    private final StaffScheduleOverrideRepository overrideRepository;
    private final ScheduleResolver scheduleResolver;
    private final BooklyProperties properties;
    private final Clock clock;

    @Override
    public ScheduleResolution resolve(Long tenantId, Long staffId, LocalDate date) {
        if (!properties.schedule().staffSchedulesEnabled()) {
            log.debug("Staff schedules disabled: tenantId={}, staffId={}", tenantId, staffId);
            return ScheduleResolution.unsupported();
        }

        List<StaffWeeklyBlock> weekly = weeklyScheduleRepository
                .findByStaffAndWeekday(tenantId, staffId, TenantHours.dayIndexOf(date));
        List<StaffScheduleOverride> overrides = overrideRepository.findByStaffAndDate(tenantId, staffId, date);

        return ScheduleResolution.resolved(scheduleResolver.resolve(weekly, overrides));
    }

    @Override
    public List<StaffWeeklyBlock> getWeekly(String tenantSlug, Long staffId) {
        Tenant tenant = tenantWithStaff(tenantSlug, staffId);
        return weeklyScheduleRepository.findByStaff(tenant.id(), staffId);
    }

    @Override
    @Transactional
    public List<StaffWeeklyBlock> replaceWeekly(ReplaceWeeklyScheduleCommand command) {
        Tenant tenant = tenantWithStaff(command.tenantSlug(), command.staffId());

        List<StaffWeeklyBlock> blocks = command.blocks().stream()
                .map(b -> new StaffWeeklyBlock(null, tenant.id(), command.staffId(),
                        b.weekday(), b.startMinute(), b.endMinute()))
                .toList();

        List<StaffWeeklyBlock> saved = weeklyScheduleRepository.replaceAll(tenant.id(), command.staffId(), blocks);
        log.info("Weekly schedule replaced: tenantId={}, staffId={}, blocks={}",
                tenant.id(), command.staffId(), saved.size());
        return saved;
    }

    @Override
    public List<StaffScheduleOverride> listOverrides(String tenantSlug, Long staffId, LocalDate from, LocalDate to) {
        Tenant tenant = tenantWithStaff(tenantSlug, staffId);
        LocalDate fromDate = from != null ? from : LocalDate.now(clock.withZone(tenant.zoneId()));
        LocalDate toDate = to != null ? to : fromDate.plusDays(DEFAULT_OVERRIDE_RANGE_DAYS);
        return overrideRepository.findByStaffAndDateRange(tenant.id(), staffId, fromDate, toDate);
    }

    @Override
    @Transactional
    public StaffScheduleOverride createOverride(CreateOverrideCommand command) {
        Tenant tenant = tenantWithStaff(command.tenantSlug(), command.staffId());

        StaffScheduleOverride candidate = new StaffScheduleOverride(null, tenant.id(), command.staffId(),
                command.date(), command.type(), command.startMinute(), command.endMinute());

        boolean duplicate = overrideRepository.findByStaffAndDate(tenant.id(), command.staffId(), command.date())
                .stream()
                .anyMatch(existing -> existing.isSameAs(candidate));
        if (duplicate) {
            log.warn("Duplicate override: tenantId={}, staffId={}, date={}, type={}",
                    tenant.id(), command.staffId(), command.date(), command.type());
            throw new DuplicateOverrideException(command.staffId(), command.date());
        }

        try {
            StaffScheduleOverride saved = overrideRepository.save(candidate);
            log.info("Override created: tenantId={}, staffId={}, overrideId={}, date={}, type={}",
                    tenant.id(), command.staffId(), saved.id(), saved.date(), saved.type());
            return saved;
        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent duplicate override: tenantId={}, staffId={}, date={}",
                    tenant.id(), command.staffId(), command.date());
            throw new DuplicateOverrideException(command.staffId(), command.date());
        }
    }

    @Override
    @Transactional
    public void deleteOverride(String tenantSlug, Long staffId, Long overrideId) {
        Tenant tenant = tenantWithStaff(tenantSlug, staffId);
        StaffScheduleOverride override = overrideRepository.findById(tenant.id(), staffId, overrideId)
                .orElseThrow(() -> {
                    log.warn("Override not found: tenantId={}, staffId={}, overrideId={}", tenant.id(), staffId, overrideId);
                    return new OverrideNotFoundException(overrideId);
                });
        overrideRepository.delete(override);
        log.info("Override deleted: tenantId={}, staffId={}, overrideId={}", tenant.id(), staffId, overrideId);
    }

    private Tenant tenantWithStaff(String tenantSlug, Long staffId) {
        Tenant tenant = getTenantUseCase.getTenant(tenantSlug);
        getCatalogUseCase.getStaff(tenant.id(), staffId);
        return tenant;
    }
}
