package personal.bookly.core.booking.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.bookly.common.exception.BusinessException;
import personal.bookly.core.booking.domain.exception.InvalidStatusTransitionException;

import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Booking 도메인 모델 테스트")
class BookingTest {

    private static final Instant START = Instant.parse("2030-01-07T15:30:00Z");

    @Test
    @DisplayName("PENDING 은 CONFIRMED, CANCELLED 로 전이 가능")
    void pendingTransitions() {
        Booking pending = booking(BookingStatus.PENDING, "Kim");

        assertThat(pending.transitionTo(BookingStatus.CONFIRMED).status()).isEqualTo(BookingStatus.CONFIRMED);
        assertThat(pending.transitionTo(BookingStatus.CANCELLED).status()).isEqualTo(BookingStatus.CANCELLED);
    }

    @Test
    @DisplayName("CANCELLED 에서 다른 상태로는 전이할 수 없다")
    void cancelledIsTerminal() {
        Booking cancelled = booking(BookingStatus.CANCELLED, "Kim");

        assertThatThrownBy(() -> cancelled.transitionTo(BookingStatus.CONFIRMED))
                .isInstanceOf(InvalidStatusTransitionException.class);
        assertThat(cancelled.transitionTo(BookingStatus.CANCELLED).status()).isEqualTo(BookingStatus.CANCELLED);
    }

    @Test
    @DisplayName("CONFIRMED 에서 PENDING 으로 되돌릴 수 없다")
    void confirmedCannotGoBack() {
        assertThatThrownBy(() -> booking(BookingStatus.CONFIRMED, "Kim").transitionTo(BookingStatus.PENDING))
                .isInstanceOf(InvalidStatusTransitionException.class);
    }

    @Test
    @DisplayName("예약 코드는 테넌트 로컬 날짜를 사용한다")
    void bookingCodeUsesLocalDate() {
        // 15:30Z 는 서울 기준 다음날 00:30
        Booking coded = booking(BookingStatus.CONFIRMED, " lee ").withBookingCode(ZoneId.of("Asia/Seoul"));

        assertThat(coded.bookingCode()).isEqualTo("L-1-10-20300108-99");
    }

    @Test
    @DisplayName("이름이 비어 있으면 X 로 시작")
    void bookingCodeWithoutName() {
        Booking coded = booking(BookingStatus.CONFIRMED, null).withBookingCode(ZoneId.of("UTC"));

        assertThat(coded.bookingCode()).startsWith("X-1-10-20300107-");
    }

    @Test
    @DisplayName("상태 문자열은 대소문자를 구분하지 않는다")
    void parseStatus() {
        assertThat(BookingStatus.from("Confirmed")).isEqualTo(BookingStatus.CONFIRMED);
        assertThatThrownBy(() -> BookingStatus.from("done"))
                .isInstanceOf(BusinessException.class)
                .hasMessage("Invalid status.");
    }

    @Test
    @DisplayName("고객 이메일 비교는 대소문자와 공백을 무시")
    void belongsToEmail() {
        Booking booking = booking(BookingStatus.CONFIRMED, "Kim");

        assertThat(booking.belongsToEmail(" KIM@example.com ")).isTrue();
        assertThat(booking.belongsToEmail("other@example.com")).isFalse();
    }

    private Booking booking(BookingStatus status, String customerName) {
        return new Booking(99L, 1L, 10L, 20L, null, 7L, customerName, null, "kim@example.com",
                START, 60, status, null, null, null, START);
    }
}
