package personal.bookly.core.membership.application.port.out;

/**
 * Booking Reference Port (Output Port)
 * 이용권 차감 대상 예약이 테넌트에 존재하는지 확인
 * Membership 도메인이 Booking 도메인의 영속성에 직접 의존하지 않도록 분리
 */
public interface BookingReferencePort {

    boolean existsInTenant(Long tenantId, Long bookingId);
}
