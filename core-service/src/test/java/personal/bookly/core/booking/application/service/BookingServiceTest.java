package personal.bookly.core.booking.application.service;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;
import personal.bookly.core.booking.application.port.in.CreateBookingCommand;
import personal.bookly.core.booking.application.port.out.BookingRepository;
import personal.bookly.core.booking.domain.exception.BookingConflictException;
import personal.bookly.core.booking.domain.exception.BookingInPastException;
import personal.bookly.core.booking.domain.exception.ProfileIncompleteException;
import personal.bookly.core.booking.domain.exception.TransientStoreException;
import personal.bookly.core.booking.domain.model.Booking;
import personal.bookly.core.booking.domain.model.BookingCreation;
import personal.bookly.core.booking.domain.model.BookingDetails;
import personal.bookly.core.booking.domain.model.BookingDraft;
import personal.bookly.core.booking.domain.model.BookingStatus;
import personal.bookly.core.booking.domain.model.ConflictResult;
import personal.bookly.core.booking.domain.model.OccupiedInterval;
import personal.bookly.core.booking.domain.model.StoredBooking;
import personal.bookly.core.booking.domain.service.BookingManager;
import personal.bookly.core.booking.domain.service.ConflictChecker;
import personal.bookly.core.catalog.application.port.in.GetCatalogUseCase;
import personal.bookly.core.catalog.domain.model.AvailabilityBasis;
import personal.bookly.core.catalog.domain.model.BookableService;
import personal.bookly.core.config.BooklyProperties;
import personal.bookly.core.customer.application.port.in.ResolveCustomerUseCase;
import personal.bookly.core.customer.domain.model.Customer;
import personal.bookly.core.tenant.application.port.in.CheckBlackoutUseCase;
import personal.bookly.core.tenant.application.port.in.GetTenantUseCase;
import personal.bookly.core.tenant.domain.model.Tenant;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("BookingService 단위 테스트")
class BookingServiceTest {

    private static final Long TENANT_ID = 1L;
    private static final Long SERVICE_ID = 10L;
    private static final Long STAFF_ID = 20L;
    private static final Instant NOW = Instant.parse("2030-01-06T00:00:00Z");
    private static final Instant START = Instant.parse("2030-01-07T01:00:00Z");
    private static final String EMAIL = "kim@example.com";

    @Mock
    private GetTenantUseCase getTenantUseCase;
    @Mock
    private GetCatalogUseCase getCatalogUseCase;
    @Mock
    private ResolveCustomerUseCase resolveCustomerUseCase;
    @Mock
    private CheckBlackoutUseCase checkBlackoutUseCase;
    @Mock
    private BookingRepository bookingRepository;
    @Mock
    private ConflictChecker conflictChecker;
    @Mock
    private BookingManager bookingManager;
    @Mock
    private BookingChangeNotifier bookingChangeNotifier;
    @Mock
    private BookingDetailsAssembler detailsAssembler;

    private MeterRegistry meterRegistry;
    private BookingService bookingService;
    private Tenant tenant;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        BooklyProperties properties = new BooklyProperties(
                new BooklyProperties.Booking(60, 20), null, null, null);
        bookingService = new BookingService(getTenantUseCase, getCatalogUseCase, resolveCustomerUseCase,
                checkBlackoutUseCase, bookingRepository, conflictChecker, bookingManager, bookingChangeNotifier,
                detailsAssembler, properties, meterRegistry, Clock.fixed(NOW, ZoneOffset.UTC));

        tenant = new Tenant(TENANT_ID, "salon", ZoneId.of("Asia/Seoul"), "KRW", false);
        lenient().when(getTenantUseCase.getTenant("salon")).thenReturn(tenant);
    }

    @Test
    @DisplayName("예약 생성 성공 - 커밋 이후 알림과 카운터")
    void createBooking_Success() {
        // given
        givenService(service(AvailabilityBasis.STAFF, null));
        givenCustomer("010-1111-2222");
        givenPrecheckPasses();
        Booking stored = stored(500L, null);
        given(bookingManager.createInTransaction(any(BookingDraft.class), eq(tenant.zoneId())))
                .willReturn(StoredBooking.created(stored));
        givenDetails();

        // when
        BookingCreation creation = bookingService.createBooking(command(STAFF_ID, null, null));

        // then
        assertThat(creation.replay()).isFalse();
        assertThat(creation.details().booking().id()).isEqualTo(500L);
        verify(bookingChangeNotifier).bookingCreated(stored);
        assertThat(meterRegistry.counter("bookly.booking.created").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("같은 멱등 키의 재요청은 기존 예약을 replay 로 반환")
    void createBooking_Replay() {
        // given
        Booking existing = stored(500L, "key-1");
        given(bookingRepository.findByIdempotencyKey(TENANT_ID, "key-1")).willReturn(Optional.of(existing));
        givenDetails();

        // when
        BookingCreation creation = bookingService.createBooking(command(STAFF_ID, null, "key-1"));

        // then
        assertThat(creation.replay()).isTrue();
        verifyNoInteractions(bookingManager, bookingChangeNotifier, resolveCustomerUseCase);
        assertThat(meterRegistry.counter("bookly.booking.replayed").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("허용 오차를 넘는 과거 시각은 거절")
    void createBooking_InPast() {
        // given
        givenService(service(AvailabilityBasis.STAFF, null));
        CreateBookingCommand past = new CreateBookingCommand("salon", SERVICE_ID, STAFF_ID, null,
                NOW.minusSeconds(61), null, EMAIL, "Kim", null, null, null);

        // when & then
        assertThatThrownBy(() -> bookingService.createBooking(past))
                .isInstanceOf(BookingInPastException.class);
        verifyNoInteractions(bookingManager);
        assertThat(meterRegistry.counter("bookly.booking.rejected", "reason", "booking_in_past").count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("허용 오차 이내의 과거 시각은 통과")
    void createBooking_WithinTolerance() {
        // given
        givenService(service(AvailabilityBasis.STAFF, null));
        givenCustomer("010-1111-2222");
        givenPrecheckPasses();
        given(bookingManager.createInTransaction(any(BookingDraft.class), any()))
                .willReturn(StoredBooking.created(stored(501L, null)));
        givenDetails();
        CreateBookingCommand recent = new CreateBookingCommand("salon", SERVICE_ID, STAFF_ID, null,
                NOW.minusSeconds(30), null, EMAIL, "Kim", null, null, null);

        // when
        BookingCreation creation = bookingService.createBooking(recent);

        // then
        assertThat(creation.replay()).isFalse();
    }

    @Test
    @DisplayName("스태프 기준 서비스에 스태프가 없으면 400")
    void createBooking_StaffRequired() {
        // given
        givenService(service(AvailabilityBasis.STAFF, null));

        // when & then
        assertThatThrownBy(() -> bookingService.createBooking(command(null, null, null)))
                .isInstanceOf(BusinessException.class)
                .hasMessage("staffId is required for this service.")
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_INPUT);
    }

    @Test
    @DisplayName("연속 슬롯 제한을 넘는 소요시간은 400")
    void createBooking_DurationTooLong() {
        // given
        givenService(service(AvailabilityBasis.STAFF, 2));
        CreateBookingCommand tooLong = new CreateBookingCommand("salon", SERVICE_ID, STAFF_ID, null,
                START, 180, EMAIL, "Kim", null, null, null);

        // when & then
        assertThatThrownBy(() -> bookingService.createBooking(tooLong))
                .isInstanceOf(BusinessException.class)
                .hasMessage("durationMinutes exceeds the maximum of 120 minutes.");
    }

    @Test
    @DisplayName("전화번호 필수 테넌트에서 번호가 없으면 409")
    void createBooking_PhoneRequired() {
        // given
        Tenant strict = new Tenant(TENANT_ID, "salon", ZoneId.of("Asia/Seoul"), "KRW", true);
        given(getTenantUseCase.getTenant("salon")).willReturn(strict);
        givenService(service(AvailabilityBasis.STAFF, null));
        givenCustomer(null);

        // when & then
        assertThatThrownBy(() -> bookingService.createBooking(command(STAFF_ID, null, null)))
                .isInstanceOf(ProfileIncompleteException.class);
        verifyNoInteractions(bookingManager);
    }

    @Test
    @DisplayName("사전 검사에서 충돌하면 트랜잭션을 시작하지 않는다")
    void createBooking_PrecheckConflict() {
        // given
        givenService(service(AvailabilityBasis.STAFF, null));
        givenCustomer("010-1111-2222");
        given(checkBlackoutUseCase.findBlocking(any(), any(), any(), any(), any(), any())).willReturn(List.of());
        OccupiedInterval other = new OccupiedInterval(9L, SERVICE_ID, STAFF_ID, null, START,
                START.plusSeconds(3600), BookingStatus.CONFIRMED);
        given(conflictChecker.check(any(), any(), any(), any(), any(), any(), anyInt(), any()))
                .willReturn(new ConflictResult(true, List.of(other)));

        // when & then
        assertThatThrownBy(() -> bookingService.createBooking(command(STAFF_ID, null, null)))
                .isInstanceOf(BookingConflictException.class);
        verifyNoInteractions(bookingManager);
    }

    @Test
    @DisplayName("잠금 대기 중 같은 멱등 키 예약이 커밋되었으면 알림 없이 replay")
    void createBooking_ReplayFoundAfterLock() {
        // given
        givenService(service(AvailabilityBasis.STAFF, null));
        givenCustomer("010-1111-2222");
        givenPrecheckPasses();
        given(bookingRepository.findByIdempotencyKey(TENANT_ID, "key-3")).willReturn(Optional.empty());
        given(bookingManager.createInTransaction(any(BookingDraft.class), any()))
                .willReturn(StoredBooking.replayed(stored(700L, "key-3")));
        givenDetails();

        // when
        BookingCreation creation = bookingService.createBooking(command(STAFF_ID, null, "key-3"));

        // then
        assertThat(creation.replay()).isTrue();
        assertThat(creation.details().booking().id()).isEqualTo(700L);
        verify(bookingChangeNotifier, never()).bookingCreated(any());
        assertThat(meterRegistry.counter("bookly.booking.replayed").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("bookly.booking.created").count()).isZero();
    }

    @Test
    @DisplayName("사전 검사 충돌 상대가 같은 멱등 키로 방금 커밋된 예약이면 replay")
    void createBooking_PrecheckConflictWithOwnTwin() {
        // given
        givenService(service(AvailabilityBasis.STAFF, null));
        givenCustomer("010-1111-2222");
        given(checkBlackoutUseCase.findBlocking(any(), any(), any(), any(), any(), any())).willReturn(List.of());
        OccupiedInterval twin = new OccupiedInterval(800L, SERVICE_ID, STAFF_ID, null, START,
                START.plusSeconds(3600), BookingStatus.CONFIRMED);
        given(conflictChecker.check(any(), any(), any(), any(), any(), any(), anyInt(), any()))
                .willReturn(new ConflictResult(true, List.of(twin)));
        given(bookingRepository.findByIdempotencyKey(TENANT_ID, "key-4"))
                .willReturn(Optional.empty())
                .willReturn(Optional.of(stored(800L, "key-4")));
        givenDetails();

        // when
        BookingCreation creation = bookingService.createBooking(command(STAFF_ID, null, "key-4"));

        // then
        assertThat(creation.replay()).isTrue();
        assertThat(creation.details().booking().id()).isEqualTo(800L);
        verifyNoInteractions(bookingManager);
    }

    @Test
    @DisplayName("잠금 범위가 다른 같은 멱등 키 요청이 유니크 제약에 걸리면 먼저 커밋된 예약을 replay")
    void createBooking_ConcurrentIdempotentInsert() {
        // given
        givenService(service(AvailabilityBasis.STAFF, null));
        givenCustomer("010-1111-2222");
        givenPrecheckPasses();
        given(bookingRepository.findByIdempotencyKey(TENANT_ID, "key-2"))
                .willReturn(Optional.empty())
                .willReturn(Optional.of(stored(600L, "key-2")));
        given(bookingManager.createInTransaction(any(BookingDraft.class), any()))
                .willThrow(new DataIntegrityViolationException("uk_bookings_tenant_idempotency"));
        givenDetails();

        // when
        BookingCreation creation = bookingService.createBooking(command(STAFF_ID, null, "key-2"));

        // then
        assertThat(creation.replay()).isTrue();
        assertThat(creation.details().booking().id()).isEqualTo(600L);
        verify(bookingChangeNotifier, never()).bookingCreated(any());
    }

    @Test
    @DisplayName("멱등 키 없는 무결성 위반은 409 CONFLICT")
    void createBooking_IntegrityViolationWithoutKey() {
        // given
        givenService(service(AvailabilityBasis.STAFF, null));
        givenCustomer("010-1111-2222");
        givenPrecheckPasses();
        given(bookingManager.createInTransaction(any(BookingDraft.class), any()))
                .willThrow(new DataIntegrityViolationException("fk"));

        // when & then
        assertThatThrownBy(() -> bookingService.createBooking(command(STAFF_ID, null, null)))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.CONFLICT);
    }

    @Test
    @DisplayName("잠금 대기 실패는 503 으로 변환")
    void createBooking_LockTimeout() {
        // given
        givenService(service(AvailabilityBasis.STAFF, null));
        givenCustomer("010-1111-2222");
        givenPrecheckPasses();
        given(bookingManager.createInTransaction(any(BookingDraft.class), any()))
                .willThrow(new PessimisticLockingFailureException("lock wait timeout"));

        // when & then
        assertThatThrownBy(() -> bookingService.createBooking(command(STAFF_ID, null, null)))
                .isInstanceOf(TransientStoreException.class);
    }

    private void givenService(BookableService service) {
        given(getCatalogUseCase.getService(TENANT_ID, SERVICE_ID)).willReturn(service);
    }

    private void givenCustomer(String phone) {
        given(resolveCustomerUseCase.resolve(any()))
                .willReturn(new Customer(7L, TENANT_ID, "Kim", phone, EMAIL));
    }

    private void givenPrecheckPasses() {
        given(checkBlackoutUseCase.findBlocking(any(), any(), any(), any(), any(), any())).willReturn(List.of());
        given(conflictChecker.check(any(), any(), any(), any(), any(), any(), anyInt(), any()))
                .willReturn(ConflictResult.none());
    }

    private void givenDetails() {
        given(detailsAssembler.assemble(eq(tenant), any(Booking.class)))
                .willAnswer(invocation -> new BookingDetails(invocation.getArgument(1), "salon", "Cut", "Ann", null));
    }

    private CreateBookingCommand command(Long staffId, Long resourceId, String idempotencyKey) {
        return new CreateBookingCommand("salon", SERVICE_ID, staffId, resourceId, START, null,
                EMAIL, "Kim", "010-1111-2222", idempotencyKey, null);
    }

    private BookableService service(AvailabilityBasis basis, Integer maxConsecutiveSlots) {
        return new BookableService(SERVICE_ID, TENANT_ID, "Cut", 60, null, 1, maxConsecutiveSlots,
                basis.includesStaff(), basis.includesResource(), false, false, basis, true);
    }

    private Booking stored(Long id, String idempotencyKey) {
        return new Booking(id, TENANT_ID, SERVICE_ID, STAFF_ID, null, 7L, "Kim", "010-1111-2222", EMAIL,
                START, 60, BookingStatus.CONFIRMED, idempotencyKey, "K-1-10-20300107-" + id, null, NOW);
    }
}
