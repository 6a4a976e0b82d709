package personal.bookly.core.booking.application.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.PessimisticLockingFailureException;
import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;
import personal.bookly.core.booking.domain.exception.TransientStoreException;
import personal.bookly.core.booking.domain.model.Booking;
import personal.bookly.core.booking.domain.model.BookingDetails;
import personal.bookly.core.booking.domain.model.BookingStatus;
import personal.bookly.core.booking.domain.model.BookingStatusChange;
import personal.bookly.core.booking.domain.service.BookingManager;
import personal.bookly.core.tenant.application.port.in.GetTenantUseCase;
import personal.bookly.core.tenant.domain.model.Tenant;

import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("BookingStatusService 단위 테스트")
class BookingStatusServiceTest {

    private static final Instant START = Instant.parse("2030-01-07T01:00:00Z");

    @Mock
    private GetTenantUseCase getTenantUseCase;
    @Mock
    private BookingManager bookingManager;
    @Mock
    private BookingChangeNotifier bookingChangeNotifier;
    @Mock
    private BookingDetailsAssembler detailsAssembler;

    @InjectMocks
    private BookingStatusService bookingStatusService;

    private final Tenant tenant = new Tenant(1L, "salon", ZoneId.of("Asia/Seoul"), "KRW", false);

    @Test
    @DisplayName("상태가 바뀌면 변경 알림을 보낸다")
    void notifiesOnChange() {
        // given
        Booking cancelled = booking(BookingStatus.CANCELLED);
        given(getTenantUseCase.getTenant("salon")).willReturn(tenant);
        given(bookingManager.changeStatus(1L, 500L, BookingStatus.CANCELLED, null))
                .willReturn(new BookingStatusChange(cancelled, true));
        given(detailsAssembler.assemble(tenant, cancelled))
                .willReturn(new BookingDetails(cancelled, "salon", "Cut", null, null));

        // when
        BookingDetails details = bookingStatusService.changeStatus("salon", 500L, BookingStatus.CANCELLED);

        // then
        assertThat(details.booking().status()).isEqualTo(BookingStatus.CANCELLED);
        verify(bookingChangeNotifier).statusChanged(cancelled);
    }

    @Test
    @DisplayName("같은 상태 요청은 알림 없이 현재 예약을 반환한다")
    void noOpDoesNotNotify() {
        // given
        Booking confirmed = booking(BookingStatus.CONFIRMED);
        given(getTenantUseCase.getTenant("salon")).willReturn(tenant);
        given(bookingManager.changeStatus(1L, 500L, BookingStatus.CONFIRMED, null))
                .willReturn(new BookingStatusChange(confirmed, false));

        // when
        bookingStatusService.changeStatus("salon", 500L, BookingStatus.CONFIRMED);

        // then
        verify(bookingChangeNotifier, never()).statusChanged(any());
        verify(detailsAssembler).assemble(tenant, confirmed);
    }

    @Test
    @DisplayName("고객 취소는 인증 이메일을 소유자 조건으로 넘긴다")
    void customerCancelPassesEmail() {
        // given
        Booking cancelled = booking(BookingStatus.CANCELLED);
        given(getTenantUseCase.getTenant("salon")).willReturn(tenant);
        given(bookingManager.changeStatus(1L, 500L, BookingStatus.CANCELLED, "kim@example.com"))
                .willReturn(new BookingStatusChange(cancelled, true));

        // when
        bookingStatusService.cancelByCustomer("salon", 500L, "kim@example.com");

        // then
        verify(bookingChangeNotifier).statusChanged(cancelled);
    }

    @Test
    @DisplayName("인증 이메일 없는 고객 취소는 UNAUTHORIZED")
    void customerCancelWithoutEmail() {
        assertThatThrownBy(() -> bookingStatusService.cancelByCustomer("salon", 500L, " "))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.UNAUTHORIZED);

        verifyNoInteractions(bookingManager);
    }

    @Test
    @DisplayName("락 대기 실패는 재시도 가능한 오류로 변환")
    void lockFailureIsTransient() {
        // given
        given(getTenantUseCase.getTenant("salon")).willReturn(tenant);
        given(bookingManager.changeStatus(1L, 500L, BookingStatus.CANCELLED, null))
                .willThrow(new PessimisticLockingFailureException("lock wait timeout"));

        // when & then
        assertThatThrownBy(() -> bookingStatusService.changeStatus("salon", 500L, BookingStatus.CANCELLED))
                .isInstanceOf(TransientStoreException.class);
        verifyNoInteractions(bookingChangeNotifier);
    }

    private Booking booking(BookingStatus status) {
        return new Booking(500L, 1L, 10L, 20L, null, 7L, "Kim", null, "kim@example.com",
                START, 60, status, null, "K-1-10-20300107-500", null, START);
    }
}
