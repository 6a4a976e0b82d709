package personal.bookly.core.booking.application.port.out;

/**
 * Booking Lock Port (Output Port)
 * 예약 트랜잭션의 잠금 기준 행(staff / resource / service)에 비관적 락을 건다
 */
public interface BookingLockPort {

    void lockStaff(Long tenantId, Long staffId);

    void lockResource(Long tenantId, Long resourceId);

    void lockService(Long tenantId, Long serviceId);
}
