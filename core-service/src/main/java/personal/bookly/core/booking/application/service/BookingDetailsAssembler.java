package personal.bookly.core.booking.application.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.bookly.core.booking.domain.model.Booking;
import personal.bookly.core.booking.domain.model.BookingDetails;
import personal.bookly.core.catalog.application.port.in.CatalogNames;
import personal.bookly.core.catalog.application.port.in.GetCatalogUseCase;
import personal.bookly.core.tenant.domain.model.Tenant;

/**
 * 예약 + 서비스/스태프/리소스 이름 결합
 */
@Component
@RequiredArgsConstructor
public class BookingDetailsAssembler {

    private final GetCatalogUseCase getCatalogUseCase;

    public BookingDetails assemble(Tenant tenant, Booking booking) {
        CatalogNames names = getCatalogUseCase.findNames(tenant.id(),
                booking.serviceId(), booking.staffId(), booking.resourceId());
        return new BookingDetails(booking, tenant.slug(),
                names.serviceName(), names.staffName(), names.resourceName());
    }
}
