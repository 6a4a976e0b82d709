package personal.bookly.core.booking.adapter.in.web.dto;

import personal.bookly.core.booking.domain.model.Booking;
import personal.bookly.core.booking.domain.model.BookingDetails;

import java.time.Instant;

/**
 * Booking Response DTO (서비스/스태프/리소스 이름 결합)
 */
public record BookingResponse(
        Long id,
        String tenantSlug,
        Long serviceId,
        String serviceName,
        Long staffId,
        String staffName,
        Long resourceId,
        String resourceName,
        Long customerId,
        String customerName,
        String customerPhone,
        String customerEmail,
        Instant startTime,
        Instant endTime,
        int durationMinutes,
        String status,
        String bookingCode,
        Long customerMembershipId,
        Instant createdAt
) {
    public static BookingResponse from(BookingDetails details) {
        Booking booking = details.booking();
        return new BookingResponse(
                booking.id(),
                details.tenantSlug(),
                booking.serviceId(),
                details.serviceName(),
                booking.staffId(),
                details.staffName(),
                booking.resourceId(),
                details.resourceName(),
                booking.customerId(),
                booking.customerName(),
                booking.customerPhone(),
                booking.customerEmail(),
                booking.startTime(),
                booking.endTime(),
                booking.durationMinutes(),
                booking.status().value(),
                booking.bookingCode(),
                booking.customerMembershipId(),
                booking.createdAt()
        );
    }
}
