package personal.bookly.core.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionTimedOutException;
import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;
import personal.bookly.core.booking.application.port.in.ChangeBookingStatusUseCase;
import personal.bookly.core.booking.domain.exception.TransientStoreException;
import personal.bookly.core.booking.domain.model.BookingDetails;
import personal.bookly.core.booking.domain.model.BookingStatus;
import personal.bookly.core.booking.domain.model.BookingStatusChange;
import personal.bookly.core.booking.domain.service.BookingManager;
import personal.bookly.core.tenant.application.port.in.GetTenantUseCase;
import personal.bookly.core.tenant.domain.model.Tenant;

/**
 * Booking Status Service
 * 취소는 이용권을 환불하지 않는다
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingStatusService implements ChangeBookingStatusUseCase {

    private final GetTenantUseCase getTenantUseCase;
    private final BookingManager bookingManager;
    private final BookingChangeNotifier bookingChangeNotifier;
    private final BookingDetailsAssembler detailsAssembler;

    @Override
    public BookingDetails changeStatus(String tenantSlug, Long bookingId, BookingStatus target) {
        Tenant tenant = getTenantUseCase.getTenant(tenantSlug);
        return apply(tenant, bookingId, target, null);
    }

    @Override
    public BookingDetails cancelByCustomer(String tenantSlug, Long bookingId, String customerEmail) {
        if (customerEmail == null || customerEmail.isBlank()) {
            throw new BusinessException(ErrorCode.UNAUTHORIZED, "Authenticated email is required");
        }
        Tenant tenant = getTenantUseCase.getTenant(tenantSlug);
        return apply(tenant, bookingId, BookingStatus.CANCELLED, customerEmail);
    }

    private BookingDetails apply(Tenant tenant, Long bookingId, BookingStatus target, String requiredEmail) {
        BookingStatusChange change;
        try {
            change = bookingManager.changeStatus(tenant.id(), bookingId, target, requiredEmail);
        } catch (TransientDataAccessException | TransactionTimedOutException e) {
            log.warn("Transient store failure during status change: tenantId={}, bookingId={}, error={}",
                    tenant.id(), bookingId, e.getMessage());
            throw new TransientStoreException("Booking store is busy", e);
        }

        if (change.changed()) {
            bookingChangeNotifier.statusChanged(change.booking());
        }
        return detailsAssembler.assemble(tenant, change.booking());
    }
}
