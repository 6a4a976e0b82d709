package personal.bookly.core.booking.domain.model;

/**
 * 상태 변경 결과
 *
 * @param changed 같은 상태로의 요청(no-op)이면 false, 이 경우 알림을 보내지 않는다
 */
public record BookingStatusChange(Booking booking, boolean changed) {
}
