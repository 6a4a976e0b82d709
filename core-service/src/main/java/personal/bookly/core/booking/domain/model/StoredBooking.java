package personal.bookly.core.booking.domain.model;

/**
 * 트랜잭션 실행 결과
 *
 * @param replayed 잠금 획득 후 같은 멱등 키의 예약이 이미 커밋되어 있어 저장 없이 반환한 경우 true
 */
public record StoredBooking(Booking booking, boolean replayed) {

    public static StoredBooking created(Booking booking) {
        return new StoredBooking(booking, false);
    }

    public static StoredBooking replayed(Booking booking) {
        return new StoredBooking(booking, true);
    }
}
