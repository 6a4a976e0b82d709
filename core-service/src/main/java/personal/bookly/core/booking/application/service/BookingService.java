package personal.bookly.core.booking.application.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionTimedOutException;
import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;
import personal.bookly.core.booking.application.port.in.CreateBookingCommand;
import personal.bookly.core.booking.application.port.in.CreateBookingUseCase;
import personal.bookly.core.booking.application.port.out.BookingRepository;
import personal.bookly.core.booking.domain.exception.BookingBlockedException;
import personal.bookly.core.booking.domain.exception.BookingConflictException;
import personal.bookly.core.booking.domain.exception.BookingInPastException;
import personal.bookly.core.booking.domain.exception.ProfileIncompleteException;
import personal.bookly.core.booking.domain.exception.TransientStoreException;
import personal.bookly.core.booking.domain.model.Booking;
import personal.bookly.core.booking.domain.model.BookingCreation;
import personal.bookly.core.booking.domain.model.BookingDraft;
import personal.bookly.core.booking.domain.model.ConflictResult;
import personal.bookly.core.booking.domain.model.StoredBooking;
import personal.bookly.core.booking.domain.service.BookingManager;
import personal.bookly.core.booking.domain.service.ConflictChecker;
import personal.bookly.core.catalog.application.port.in.GetCatalogUseCase;
import personal.bookly.core.catalog.domain.model.AvailabilityBasis;
import personal.bookly.core.catalog.domain.model.BookableService;
import personal.bookly.core.config.BooklyProperties;
import personal.bookly.core.customer.application.port.in.ResolveCustomerCommand;
import personal.bookly.core.customer.application.port.in.ResolveCustomerUseCase;
import personal.bookly.core.customer.domain.model.Customer;
import personal.bookly.core.tenant.application.port.in.CheckBlackoutUseCase;
import personal.bookly.core.tenant.application.port.in.GetTenantUseCase;
import personal.bookly.core.tenant.domain.model.Blackout;
import personal.bookly.core.tenant.domain.model.Tenant;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Booking Service (예약 생성)
 * 검증과 사전 검사는 트랜잭션 밖에서, 잠금/재검사/저장은 BookingManager 트랜잭션 안에서 수행
 * 커밋 이후에만 heartbeat와 이벤트를 보낸다
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingService implements CreateBookingUseCase {

    private static final int DEFAULT_PAST_TOLERANCE_SECONDS = 60;

    private final GetTenantUseCase getTenantUseCase;
    private final GetCatalogUseCase getCatalogUseCase;
    private final ResolveCustomerUseCase resolveCustomerUseCase;
    private final CheckBlackoutUseCase checkBlackoutUseCase;
    private final BookingRepository bookingRepository;
    private final ConflictChecker conflictChecker;
    private final BookingManager bookingManager;
    private final BookingChangeNotifier bookingChangeNotifier;
    private final BookingDetailsAssembler detailsAssembler;
    private final BooklyProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Override
    public BookingCreation createBooking(CreateBookingCommand command) {
        try {
            return create(command);
        } catch (BusinessException e) {
            countRejected(e.getErrorCode());
            throw e;
        }
    }

    private BookingCreation create(CreateBookingCommand command) {
        Tenant tenant = getTenantUseCase.getTenant(command.tenantSlug());

        // 1. 멱등 재요청
        Optional<BookingCreation> replay = findReplay(tenant, command);
        if (replay.isPresent()) {
            return replay.get();
        }

        // 2. 서비스, 스태프, 리소스, 소요시간 검증
        BookableService service = getCatalogUseCase.getService(tenant.id(), command.serviceId());
        validateParticipants(tenant, service, command);
        int durationMinutes = resolveDuration(service, command);

        // 3. 과거 시각 (허용 오차 이내는 통과)
        Instant now = clock.instant();
        if (command.startTime().isBefore(now.minusSeconds(pastToleranceSeconds()))) {
            log.warn("Booking in the past: tenantId={}, startTime={}", tenant.id(), command.startTime());
            throw new BookingInPastException();
        }

        // 4. 고객 식별 및 전화번호 정책
        Customer customer = resolveCustomerUseCase.resolve(new ResolveCustomerCommand(
                tenant.id(), command.customerEmail(), command.customerName(), command.customerPhone()));
        if (tenant.requirePhone() && !customer.hasPhone()) {
            log.warn("Phone required before booking: tenantId={}, customerId={}", tenant.id(), customer.id());
            throw new ProfileIncompleteException();
        }

        BookingDraft draft = new BookingDraft(
                tenant.id(),
                service.id(),
                command.staffId(),
                command.resourceId(),
                customer,
                command.startTime(),
                durationMinutes,
                service.capacity(),
                service.requiresConfirmation(),
                service.allowMembership(),
                command.idempotencyKey(),
                command.membershipRequest());

        // 5. 사전 검사 (잠금 없음, 빠른 실패용)
        try {
            precheck(draft);
        } catch (BookingConflictException e) {
            // 1단계 조회 이후 같은 멱등 키의 요청이 커밋되어 자기 예약과 충돌한 경우
            Optional<BookingCreation> lateReplay = findReplay(tenant, command);
            if (lateReplay.isPresent()) {
                return lateReplay.get();
            }
            throw e;
        }

        // 6. 트랜잭션 실행
        StoredBooking stored;
        try {
            stored = bookingManager.createInTransaction(draft, tenant.zoneId());

        } catch (DataIntegrityViolationException e) {
            // 같은 멱등 키의 동시 요청이 먼저 커밋된 경우
            if (command.hasIdempotencyKey()) {
                Optional<BookingCreation> concurrentReplay = findReplay(tenant, command);
                if (concurrentReplay.isPresent()) {
                    log.info("Concurrent idempotent booking resolved as replay: tenantId={}", tenant.id());
                    return concurrentReplay.get();
                }
            }
            log.warn("Booking integrity violation: tenantId={}, serviceId={}", tenant.id(), service.id());
            throw new BusinessException(ErrorCode.CONFLICT, "Booking could not be stored.");

        } catch (TransientDataAccessException | TransactionTimedOutException e) {
            log.warn("Transient store failure during booking: tenantId={}, error={}", tenant.id(), e.getMessage());
            throw new TransientStoreException("Booking store is busy", e);
        }

        if (stored.replayed()) {
            return replay(tenant, stored.booking());
        }

        // 7. 커밋 이후 알림
        Booking booking = stored.booking();
        bookingChangeNotifier.bookingCreated(booking);
        counter("bookly.booking.created").increment();

        log.info("Booking created: tenantId={}, bookingId={}, code={}, status={}",
                tenant.id(), booking.id(), booking.bookingCode(), booking.status());
        return BookingCreation.created(detailsAssembler.assemble(tenant, booking));
    }

    private Optional<BookingCreation> findReplay(Tenant tenant, CreateBookingCommand command) {
        if (!command.hasIdempotencyKey()) {
            return Optional.empty();
        }
        return bookingRepository.findByIdempotencyKey(tenant.id(), command.idempotencyKey())
                .map(existing -> replay(tenant, existing));
    }

    private BookingCreation replay(Tenant tenant, Booking existing) {
        log.info("Idempotent replay: tenantId={}, bookingId={}", tenant.id(), existing.id());
        counter("bookly.booking.replayed").increment();
        return BookingCreation.replayed(detailsAssembler.assemble(tenant, existing));
    }

    private void validateParticipants(Tenant tenant, BookableService service, CreateBookingCommand command) {
        AvailabilityBasis basis = service.effectiveBasis();
        if ((basis.includesStaff() || service.requiresStaff()) && command.staffId() == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "staffId is required for this service.");
        }
        if ((basis.includesResource() || service.requiresResource()) && command.resourceId() == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "resourceId is required for this service.");
        }
        if (command.staffId() != null) {
            getCatalogUseCase.getStaff(tenant.id(), command.staffId());
        }
        if (command.resourceId() != null) {
            getCatalogUseCase.getResource(tenant.id(), command.resourceId());
        }
    }

    private int resolveDuration(BookableService service, CreateBookingCommand command) {
        int duration = command.durationMinutes() != null ? command.durationMinutes() : service.durationMinutes();
        Integer max = service.maxDurationMinutes();
        if (max != null && duration > max) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("durationMinutes exceeds the maximum of %d minutes.", max));
        }
        return duration;
    }

    private void precheck(BookingDraft draft) {
        List<Blackout> blocking = checkBlackoutUseCase.findBlocking(draft.tenantId(), draft.startTime(),
                draft.endTime(), draft.serviceId(), draft.staffId(), draft.resourceId());
        if (!blocking.isEmpty()) {
            log.warn("Booking blocked: tenantId={}, blackoutId={}", draft.tenantId(), blocking.get(0).id());
            throw new BookingBlockedException(blocking.get(0));
        }

        ConflictResult conflict = conflictChecker.check(draft.tenantId(), draft.serviceId(), draft.staffId(),
                draft.resourceId(), draft.startTime(), draft.endTime(), draft.capacity(), null);
        if (conflict.conflict()) {
            log.warn("Booking conflict: tenantId={}, staffId={}, resourceId={}, rows={}",
                    draft.tenantId(), draft.staffId(), draft.resourceId(), conflict.rows().size());
            throw new BookingConflictException(conflict.rows());
        }
    }

    private int pastToleranceSeconds() {
        int configured = properties.booking() == null ? -1 : properties.booking().pastToleranceSeconds();
        return configured >= 0 ? configured : DEFAULT_PAST_TOLERANCE_SECONDS;
    }

    private void countRejected(ErrorCode errorCode) {
        Counter.builder("bookly.booking.rejected")
                .tag("reason", errorCode.name().toLowerCase(Locale.ROOT))
                .description("Number of rejected booking requests")
                .register(meterRegistry)
                .increment();
    }

    private Counter counter(String name) {
        return Counter.builder(name).register(meterRegistry);
    }
}
