package personal.bookly.core.availability.application.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.bookly.common.time.TimeWindow;
import personal.bookly.core.availability.application.port.in.AvailabilityQuery;
import personal.bookly.core.availability.application.port.out.BusyIntervalPort;
import personal.bookly.core.availability.domain.model.AvailabilityReason;
import personal.bookly.core.availability.domain.model.DayAvailability;
import personal.bookly.core.availability.domain.model.OccupiedSpan;
import personal.bookly.core.availability.domain.model.ScheduleSource;
import personal.bookly.core.availability.domain.model.Slot;
import personal.bookly.core.availability.domain.service.SlotCalculator;
import personal.bookly.core.catalog.application.port.in.GetCatalogUseCase;
import personal.bookly.core.catalog.domain.exception.StaffNotFoundException;
import personal.bookly.core.catalog.domain.model.AvailabilityBasis;
import personal.bookly.core.catalog.domain.model.BookableService;
import personal.bookly.core.schedule.application.port.in.ResolveStaffScheduleUseCase;
import personal.bookly.core.schedule.domain.model.ScheduleResolution;
import personal.bookly.core.schedule.domain.service.ScheduleResolver;
import personal.bookly.core.tenant.application.port.in.CheckBlackoutUseCase;
import personal.bookly.core.tenant.application.port.in.GetTenantUseCase;
import personal.bookly.core.tenant.application.port.in.ManageTenantHoursUseCase;
import personal.bookly.core.tenant.domain.model.Blackout;
import personal.bookly.core.tenant.domain.model.Tenant;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("AvailabilityService 단위 테스트")
class AvailabilityServiceTest {

    private static final Long TENANT_ID = 1L;
    private static final Long SERVICE_ID = 10L;
    private static final Long STAFF_ID = 20L;
    private static final LocalDate DATE = LocalDate.of(2030, 1, 7);
    private static final ZoneId ZONE = ZoneId.of("Asia/Seoul");

    @Mock
    private GetTenantUseCase getTenantUseCase;
    @Mock
    private GetCatalogUseCase getCatalogUseCase;
    @Mock
    private ManageTenantHoursUseCase manageTenantHoursUseCase;
    @Mock
    private ResolveStaffScheduleUseCase resolveStaffScheduleUseCase;
    @Spy
    private ScheduleResolver scheduleResolver = new ScheduleResolver();
    @Mock
    private CheckBlackoutUseCase checkBlackoutUseCase;
    @Mock
    private BusyIntervalPort busyIntervalPort;
    @Spy
    private SlotCalculator slotCalculator = new SlotCalculator();
    @InjectMocks
    private AvailabilityService availabilityService;

    private Tenant tenant;

    @BeforeEach
    void setUp() {
        tenant = new Tenant(TENANT_ID, "salon", ZONE, "KRW", false);
        given(getTenantUseCase.getTenant("salon")).willReturn(tenant);
    }

    @Test
    @DisplayName("스태프 기준 서비스에 스태프가 없으면 빈 슬롯 + staff_required")
    void staffRequired() {
        // given
        given(getCatalogUseCase.getService(TENANT_ID, SERVICE_ID)).willReturn(service(AvailabilityBasis.STAFF, 1));

        // when
        DayAvailability result = availabilityService.getAvailability(query(null));

        // then
        assertThat(result.slots()).isEmpty();
        assertThat(result.meta().reason()).isEqualTo(AvailabilityReason.STAFF_REQUIRED);
        verifyNoInteractions(manageTenantHoursUseCase, busyIntervalPort);
    }

    @Test
    @DisplayName("휴무일이면 빈 슬롯 + tenant_closed")
    void tenantClosed() {
        // given
        given(getCatalogUseCase.getService(TENANT_ID, SERVICE_ID)).willReturn(service(AvailabilityBasis.NONE, 1));
        given(manageTenantHoursUseCase.openWindow(TENANT_ID, DATE)).willReturn(Optional.empty());

        // when
        DayAvailability result = availabilityService.getAvailability(query(null));

        // then
        assertThat(result.slots()).isEmpty();
        assertThat(result.meta().reason()).isEqualTo(AvailabilityReason.TENANT_CLOSED);
        assertThat(result.meta().scheduleSource()).isEqualTo(ScheduleSource.TENANT_HOURS);
    }

    @Test
    @DisplayName("기준이 없으면 같은 서비스 예약으로 용량을 판단")
    void serviceLevelCapacity() {
        // given
        given(getCatalogUseCase.getService(TENANT_ID, SERVICE_ID)).willReturn(service(AvailabilityBasis.NONE, 2));
        given(manageTenantHoursUseCase.openWindow(TENANT_ID, DATE)).willReturn(Optional.of(TimeWindow.of(540, 660)));
        Instant nine = tenant.instantAt(DATE, 540);
        Instant ten = tenant.instantAt(DATE, 600);
        given(busyIntervalPort.findByService(eq(TENANT_ID), eq(SERVICE_ID), any(), any()))
                .willReturn(List.of(new OccupiedSpan(nine, ten), new OccupiedSpan(nine, ten)));
        given(checkBlackoutUseCase.findBlocking(eq(TENANT_ID), any(), any(), eq(SERVICE_ID), isNull(), isNull()))
                .willReturn(List.of());

        // when
        DayAvailability result = availabilityService.getAvailability(query(null));

        // then
        assertThat(result.slots()).extracting(Slot::available).containsExactly(false, true);
        assertThat(result.slots().get(0).overlaps()).isEqualTo(2);
        assertThat(result.meta().maxParallelBookings()).isEqualTo(2);
        assertThat(result.meta().reason()).isNull();
        verify(busyIntervalPort, never()).findByStaff(anyLong(), anyLong(), any(), any());
    }

    @Test
    @DisplayName("스태프 일정이 있으면 근무 블록과 영업 창의 교집합으로 슬롯 생성")
    void staffScheduleIntersection() {
        // given
        given(getCatalogUseCase.getService(TENANT_ID, SERVICE_ID)).willReturn(service(AvailabilityBasis.STAFF, 1));
        given(manageTenantHoursUseCase.openWindow(TENANT_ID, DATE)).willReturn(Optional.of(TimeWindow.of(540, 1020)));
        given(resolveStaffScheduleUseCase.resolve(TENANT_ID, STAFF_ID, DATE))
                .willReturn(ScheduleResolution.resolved(List.of(TimeWindow.of(480, 660))));
        given(busyIntervalPort.findByStaff(eq(TENANT_ID), eq(STAFF_ID), any(), any())).willReturn(List.of());
        given(checkBlackoutUseCase.findBlocking(eq(TENANT_ID), any(), any(), eq(SERVICE_ID), eq(STAFF_ID), isNull()))
                .willReturn(List.of());

        // when
        DayAvailability result = availabilityService.getAvailability(query(STAFF_ID));

        // then
        assertThat(result.slots()).extracting(Slot::time).containsExactly("09:00", "10:00");
        assertThat(result.meta().scheduleSource()).isEqualTo(ScheduleSource.STAFF_SCHEDULE);
        verify(getCatalogUseCase).getStaff(TENANT_ID, STAFF_ID);
    }

    @Test
    @DisplayName("스태프 일정 미지원이면 영업시간으로 대체")
    void staffScheduleUnsupported() {
        // given
        given(getCatalogUseCase.getService(TENANT_ID, SERVICE_ID)).willReturn(service(AvailabilityBasis.STAFF, 1));
        given(manageTenantHoursUseCase.openWindow(TENANT_ID, DATE)).willReturn(Optional.of(TimeWindow.of(540, 720)));
        given(resolveStaffScheduleUseCase.resolve(TENANT_ID, STAFF_ID, DATE)).willReturn(ScheduleResolution.unsupported());
        given(busyIntervalPort.findByStaff(eq(TENANT_ID), eq(STAFF_ID), any(), any())).willReturn(List.of());
        given(checkBlackoutUseCase.findBlocking(eq(TENANT_ID), any(), any(), eq(SERVICE_ID), eq(STAFF_ID), isNull()))
                .willReturn(List.of());

        // when
        DayAvailability result = availabilityService.getAvailability(query(STAFF_ID));

        // then
        assertThat(result.slots()).hasSize(3);
        assertThat(result.meta().scheduleSource()).isEqualTo(ScheduleSource.TENANT_HOURS_FALLBACK);
    }

    @Test
    @DisplayName("근무 블록이 영업 창과 겹치지 않으면 staff_unavailable")
    void staffUnavailable() {
        // given
        given(getCatalogUseCase.getService(TENANT_ID, SERVICE_ID)).willReturn(service(AvailabilityBasis.STAFF, 1));
        given(manageTenantHoursUseCase.openWindow(TENANT_ID, DATE)).willReturn(Optional.of(TimeWindow.of(540, 720)));
        given(resolveStaffScheduleUseCase.resolve(TENANT_ID, STAFF_ID, DATE))
                .willReturn(ScheduleResolution.resolved(List.of()));

        // when
        DayAvailability result = availabilityService.getAvailability(query(STAFF_ID));

        // then
        assertThat(result.slots()).isEmpty();
        assertThat(result.meta().reason()).isEqualTo(AvailabilityReason.STAFF_UNAVAILABLE);
        verifyNoInteractions(busyIntervalPort);
    }

    @Test
    @DisplayName("블랙아웃에 걸린 슬롯은 blackout_hits 와 함께 불가")
    void blackoutHits() {
        // given
        given(getCatalogUseCase.getService(TENANT_ID, SERVICE_ID)).willReturn(service(AvailabilityBasis.NONE, 3));
        given(manageTenantHoursUseCase.openWindow(TENANT_ID, DATE)).willReturn(Optional.of(TimeWindow.of(540, 660)));
        given(busyIntervalPort.findByService(eq(TENANT_ID), eq(SERVICE_ID), any(), any())).willReturn(List.of());
        Blackout lunch = new Blackout(5L, TENANT_ID, null, null, null,
                tenant.instantAt(DATE, 600), tenant.instantAt(DATE, 630), "lunch", true, Instant.EPOCH);
        given(checkBlackoutUseCase.findBlocking(eq(TENANT_ID), any(), any(), eq(SERVICE_ID), isNull(), isNull()))
                .willReturn(List.of(lunch));

        // when
        DayAvailability result = availabilityService.getAvailability(query(null));

        // then
        assertThat(result.slots()).extracting(Slot::blackoutHits).containsExactly(0, 1);
        assertThat(result.slots()).extracting(Slot::available).containsExactly(true, false);
    }

    @Test
    @DisplayName("다른 테넌트의 스태프는 404")
    void unknownStaff() {
        // given
        given(getCatalogUseCase.getService(TENANT_ID, SERVICE_ID)).willReturn(service(AvailabilityBasis.STAFF, 1));
        given(getCatalogUseCase.getStaff(TENANT_ID, STAFF_ID)).willThrow(new StaffNotFoundException(STAFF_ID));

        // when & then
        assertThatThrownBy(() -> availabilityService.getAvailability(query(STAFF_ID)))
                .isInstanceOf(StaffNotFoundException.class);
        verifyNoInteractions(manageTenantHoursUseCase);
    }

    private AvailabilityQuery query(Long staffId) {
        return new AvailabilityQuery("salon", SERVICE_ID, DATE, staffId, null);
    }

    private BookableService service(AvailabilityBasis basis, int capacity) {
        return new BookableService(SERVICE_ID, TENANT_ID, "Cut", 60, null, capacity, null,
                basis.includesStaff(), basis.includesResource(), false, false, basis, true);
    }
}
