package personal.bookly.core.booking.domain.model;

/**
 * 예약 생성 결과
 *
 * @param replay 같은 멱등 키로 이미 생성된 예약을 반환한 경우 true
 */
public record BookingCreation(BookingDetails details, boolean replay) {

    public static BookingCreation created(BookingDetails details) {
        return new BookingCreation(details, false);
    }

    public static BookingCreation replayed(BookingDetails details) {
        return new BookingCreation(details, true);
    }
}
