package personal.bookly.core.booking.domain.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.bookly.core.booking.application.port.out.BookingOccupancyRepository;
import personal.bookly.core.booking.domain.model.BookingStatus;
import personal.bookly.core.booking.domain.model.ConflictResult;
import personal.bookly.core.booking.domain.model.OccupiedInterval;
import personal.bookly.core.config.BooklyProperties;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("ConflictChecker 단위 테스트")
class ConflictCheckerTest {

    private static final Long TENANT_ID = 1L;
    private static final Long SERVICE_ID = 10L;
    private static final Long STAFF_ID = 20L;
    private static final Long RESOURCE_ID = 30L;
    private static final Instant FROM = Instant.parse("2030-01-07T01:00:00Z");
    private static final Instant TO = Instant.parse("2030-01-07T02:00:00Z");

    @Mock
    private BookingOccupancyRepository occupancyRepository;

    private ConflictChecker conflictChecker;

    @BeforeEach
    void setUp() {
        BooklyProperties properties = new BooklyProperties(
                new BooklyProperties.Booking(60, 20), null, null, null);
        conflictChecker = new ConflictChecker(occupancyRepository, properties);
    }

    @Test
    @DisplayName("스태프 예약이 용량만큼 있으면 충돌")
    void staffSaturated() {
        // given
        given(occupancyRepository.findOverlappingByStaff(TENANT_ID, STAFF_ID, FROM, TO, null, 20))
                .willReturn(List.of(row(100L, STAFF_ID, null)));

        // when
        ConflictResult result = conflictChecker.check(TENANT_ID, SERVICE_ID, STAFF_ID, null, FROM, TO, 1, null);

        // then
        assertThat(result.conflict()).isTrue();
        assertThat(result.rows()).extracting(OccupiedInterval::bookingId).containsExactly(100L);
        verify(occupancyRepository, never()).findOverlappingByService(anyLong(), anyLong(), any(), any(), any(), anyInt());
    }

    @Test
    @DisplayName("용량보다 적게 겹치면 충돌 아님")
    void belowCapacity() {
        // given
        given(occupancyRepository.findOverlappingByStaff(TENANT_ID, STAFF_ID, FROM, TO, null, 20))
                .willReturn(List.of(row(100L, STAFF_ID, null)));

        // when
        ConflictResult result = conflictChecker.check(TENANT_ID, SERVICE_ID, STAFF_ID, null, FROM, TO, 2, null);

        // then
        assertThat(result.conflict()).isFalse();
        assertThat(result.rows()).isEmpty();
    }

    @Test
    @DisplayName("스태프는 비어 있어도 리소스가 가득 차면 충돌")
    void resourceSaturatedIndependently() {
        // given
        given(occupancyRepository.findOverlappingByStaff(TENANT_ID, STAFF_ID, FROM, TO, null, 20))
                .willReturn(List.of());
        given(occupancyRepository.findOverlappingByResource(TENANT_ID, RESOURCE_ID, FROM, TO, null, 20))
                .willReturn(List.of(row(200L, null, RESOURCE_ID)));

        // when
        ConflictResult result = conflictChecker.check(TENANT_ID, SERVICE_ID, STAFF_ID, RESOURCE_ID, FROM, TO, 1, null);

        // then
        assertThat(result.conflict()).isTrue();
        assertThat(result.rows()).extracting(OccupiedInterval::bookingId).containsExactly(200L);
    }

    @Test
    @DisplayName("양쪽에 잡힌 같은 예약은 한 번만 반환")
    void deduplicatesRows() {
        // given
        OccupiedInterval both = row(300L, STAFF_ID, RESOURCE_ID);
        given(occupancyRepository.findOverlappingByStaff(TENANT_ID, STAFF_ID, FROM, TO, null, 20))
                .willReturn(List.of(both));
        given(occupancyRepository.findOverlappingByResource(TENANT_ID, RESOURCE_ID, FROM, TO, null, 20))
                .willReturn(List.of(both));

        // when
        ConflictResult result = conflictChecker.check(TENANT_ID, SERVICE_ID, STAFF_ID, RESOURCE_ID, FROM, TO, 1, null);

        // then
        assertThat(result.rows()).hasSize(1);
    }

    @Test
    @DisplayName("스태프/리소스가 없으면 같은 서비스 겹침으로 판단")
    void serviceLevel() {
        // given
        given(occupancyRepository.findOverlappingByService(TENANT_ID, SERVICE_ID, FROM, TO, null, 20))
                .willReturn(List.of(row(1L, null, null), row(2L, null, null)));

        // when
        ConflictResult atTwo = conflictChecker.check(TENANT_ID, SERVICE_ID, null, null, FROM, TO, 2, null);
        ConflictResult atThree = conflictChecker.check(TENANT_ID, SERVICE_ID, null, null, FROM, TO, 3, null);

        // then
        assertThat(atTwo.conflict()).isTrue();
        assertThat(atThree.conflict()).isFalse();
    }

    @Test
    @DisplayName("용량이 조회 한도보다 크면 용량만큼 조회")
    void fetchLimitFollowsCapacity() {
        // given
        given(occupancyRepository.findOverlappingByService(TENANT_ID, SERVICE_ID, FROM, TO, null, 50))
                .willReturn(List.of());

        // when
        ConflictResult result = conflictChecker.check(TENANT_ID, SERVICE_ID, null, null, FROM, TO, 50, null);

        // then
        assertThat(result.conflict()).isFalse();
    }

    private OccupiedInterval row(Long bookingId, Long staffId, Long resourceId) {
        return new OccupiedInterval(bookingId, SERVICE_ID, staffId, resourceId, FROM, TO, BookingStatus.CONFIRMED);
    }
}
