package personal.bookly.core.booking.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.bookly.core.booking.adapter.in.web.dto.BookingEnvelope;
import personal.bookly.core.booking.adapter.in.web.dto.BookingListResponse;
import personal.bookly.core.booking.adapter.in.web.dto.BookingResponse;
import personal.bookly.core.booking.adapter.in.web.dto.CreateBookingRequest;
import personal.bookly.core.booking.adapter.in.web.dto.CreateBookingResponse;
import personal.bookly.core.booking.adapter.in.web.dto.UpdateBookingStatusRequest;
import personal.bookly.core.booking.application.port.in.ChangeBookingStatusUseCase;
import personal.bookly.core.booking.application.port.in.CreateBookingUseCase;
import personal.bookly.core.booking.application.port.in.GetBookingUseCase;
import personal.bookly.core.booking.domain.model.BookingCreation;
import personal.bookly.core.booking.domain.model.BookingStatus;

import java.time.LocalDate;

/**
 * Booking API Controller
 * 인증은 상위 게이트웨이가 처리하고 X-User-Email / X-User-Name 헤더로 전달한다
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/bookings")
@RequiredArgsConstructor
public class BookingController {

    private static final String USER_EMAIL_HEADER = "X-User-Email";
    private static final String USER_NAME_HEADER = "X-User-Name";
    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final CreateBookingUseCase createBookingUseCase;
    private final ChangeBookingStatusUseCase changeBookingStatusUseCase;
    private final GetBookingUseCase getBookingUseCase;

    /**
     * 예약 생성
     * POST /api/v1/bookings?tenant={slug}
     * 신규 201, 같은 Idempotency-Key 재요청은 200 + replay=true
     */
    @PostMapping
    public ResponseEntity<CreateBookingResponse> create(
            @RequestParam("tenant") String tenant,
            @RequestHeader(value = USER_EMAIL_HEADER, required = false) String userEmail,
            @RequestHeader(value = USER_NAME_HEADER, required = false) String userName,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody CreateBookingRequest request
    ) {
        log.info("Create booking: tenant={}, serviceId={}, staffId={}, resourceId={}, startTime={}",
                tenant, request.serviceId(), request.staffId(), request.resourceId(), request.startTime());

        BookingCreation creation = createBookingUseCase.createBooking(
                request.toCommand(tenant, userEmail, userName, idempotencyKey));

        return ResponseEntity.status(creation.replay() ? HttpStatus.OK : HttpStatus.CREATED)
                .body(CreateBookingResponse.from(creation));
    }

    @GetMapping("/{bookingId}")
    public ResponseEntity<BookingEnvelope> get(
            @RequestParam("tenant") String tenant,
            @PathVariable Long bookingId
    ) {
        return ResponseEntity.ok(BookingEnvelope.from(getBookingUseCase.getBooking(tenant, bookingId)));
    }

    /**
     * GET /api/v1/bookings?tenant={slug}&date=yyyy-MM-dd
     */
    @GetMapping
    public ResponseEntity<BookingListResponse> listByDate(
            @RequestParam("tenant") String tenant,
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        var bookings = getBookingUseCase.listByDate(tenant, date).stream()
                .map(BookingResponse::from)
                .toList();
        return ResponseEntity.ok(new BookingListResponse(bookings));
    }

    @PatchMapping("/{bookingId}/status")
    public ResponseEntity<BookingEnvelope> updateStatus(
            @RequestParam("tenant") String tenant,
            @PathVariable Long bookingId,
            @Valid @RequestBody UpdateBookingStatusRequest request
    ) {
        log.info("Update booking status: tenant={}, bookingId={}, status={}", tenant, bookingId, request.status());

        BookingStatus target = BookingStatus.from(request.status());
        return ResponseEntity.ok(BookingEnvelope.from(
                changeBookingStatusUseCase.changeStatus(tenant, bookingId, target)));
    }

    /**
     * 고객 본인 취소
     */
    @DeleteMapping("/{bookingId}")
    public ResponseEntity<BookingEnvelope> cancel(
            @RequestParam("tenant") String tenant,
            @PathVariable Long bookingId,
            @RequestHeader(value = USER_EMAIL_HEADER, required = false) String userEmail
    ) {
        log.info("Customer cancel booking: tenant={}, bookingId={}", tenant, bookingId);

        return ResponseEntity.ok(BookingEnvelope.from(
                changeBookingStatusUseCase.cancelByCustomer(tenant, bookingId, userEmail)));
    }
}
