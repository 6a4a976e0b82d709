package personal.bookly.core.booking.domain.model;

/**
 * 서비스/스태프/리소스 이름이 결합된 예약 (조회 응답용)
 */
public record BookingDetails(
        Booking booking,
        String tenantSlug,
        String serviceName,
        String staffName,
        String resourceName) {
}
