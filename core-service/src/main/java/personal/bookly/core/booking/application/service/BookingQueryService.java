package personal.bookly.core.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.bookly.core.booking.application.port.in.GetBookingUseCase;
import personal.bookly.core.booking.application.port.out.BookingRepository;
import personal.bookly.core.booking.domain.exception.BookingNotFoundException;
import personal.bookly.core.booking.domain.model.BookingDetails;
import personal.bookly.core.tenant.application.port.in.GetTenantUseCase;
import personal.bookly.core.tenant.domain.model.Tenant;

import java.time.LocalDate;
import java.util.List;

/**
 * Booking Query Service
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class BookingQueryService implements GetBookingUseCase {

    private final GetTenantUseCase getTenantUseCase;
    private final BookingRepository bookingRepository;
    private final BookingDetailsAssembler detailsAssembler;

    @Override
    public BookingDetails getBooking(String tenantSlug, Long bookingId) {
        Tenant tenant = getTenantUseCase.getTenant(tenantSlug);
        return bookingRepository.findById(tenant.id(), bookingId)
                .map(booking -> detailsAssembler.assemble(tenant, booking))
                .orElseThrow(() -> {
                    log.warn("Booking not found: tenantId={}, bookingId={}", tenant.id(), bookingId);
                    return new BookingNotFoundException(bookingId);
                });
    }

    @Override
    public List<BookingDetails> listByDate(String tenantSlug, LocalDate date) {
        Tenant tenant = getTenantUseCase.getTenant(tenantSlug);
        return bookingRepository.findStartingBetween(tenant.id(),
                        tenant.instantAt(date, 0), tenant.instantAt(date.plusDays(1), 0)).stream()
                .map(booking -> detailsAssembler.assemble(tenant, booking))
                .toList();
    }
}
