package personal.bookly.core.booking.domain.model;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;
import personal.bookly.core.booking.domain.exception.InvalidStatusTransitionException;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Booking Domain Model
 * 예약 도메인 모델 (불변), 시간 구간은 [startTime, startTime + duration)
 */
public record Booking(
        Long id,
        Long tenantId,
        Long serviceId,
        Long staffId,
        Long resourceId,
        Long customerId,
        String customerName,
        String customerPhone,
        String customerEmail,
        Instant startTime,
        int durationMinutes,
        BookingStatus status,
        String idempotencyKey,
        String bookingCode,
        Long customerMembershipId,
        Instant createdAt) {

    private static final DateTimeFormatter CODE_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    public Booking {
        if (tenantId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Tenant ID cannot be null");
        }
        if (startTime == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Start time cannot be null");
        }
        if (durationMinutes <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Duration must be positive: " + durationMinutes);
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking status cannot be null");
        }
    }

    /**
     * 예약 생성 (정적 팩토리 메서드)
     * 확인이 필요한 서비스는 PENDING, 아니면 CONFIRMED로 시작
     */
    public static Booking create(BookingDraft draft, Long customerMembershipId) {
        return new Booking(
                null,
                draft.tenantId(),
                draft.serviceId(),
                draft.staffId(),
                draft.resourceId(),
                draft.customer().id(),
                draft.customer().name(),
                draft.customer().phone(),
                draft.customer().email(),
                draft.startTime(),
                draft.durationMinutes(),
                draft.requiresConfirmation() ? BookingStatus.PENDING : BookingStatus.CONFIRMED,
                draft.idempotencyKey(),
                null,
                customerMembershipId,
                null);
    }

    public Instant endTime() {
        return startTime.plusSeconds(durationMinutes * 60L);
    }

    /**
     * 상태 전이
     *
     * @throws InvalidStatusTransitionException 허용되지 않은 전이 (409)
     */
    public Booking transitionTo(BookingStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStatusTransitionException(id, status, target);
        }
        return new Booking(id, tenantId, serviceId, staffId, resourceId, customerId,
                customerName, customerPhone, customerEmail, startTime, durationMinutes,
                target, idempotencyKey, bookingCode, customerMembershipId, createdAt);
    }

    /**
     * 예약 코드 부여: {고객 이름 첫 글자}-{tenantId}-{serviceId}-{로컬 시작일 yyyyMMdd}-{bookingId}
     * 이미 코드가 있으면 유지
     */
    public Booking withBookingCode(ZoneId zoneId) {
        if (bookingCode != null) {
            return this;
        }
        String trimmed = customerName == null ? "" : customerName.trim();
        String initial = trimmed.isEmpty() ? "X" : trimmed.substring(0, 1).toUpperCase(Locale.ROOT);
        String code = String.format("%s-%d-%d-%s-%d",
                initial,
                tenantId,
                serviceId == null ? 0L : serviceId,
                CODE_DATE.format(startTime.atZone(zoneId)),
                id);
        return new Booking(id, tenantId, serviceId, staffId, resourceId, customerId,
                customerName, customerPhone, customerEmail, startTime, durationMinutes,
                status, idempotencyKey, code, customerMembershipId, createdAt);
    }

    public boolean belongsToEmail(String email) {
        return email != null && customerEmail != null
                && customerEmail.trim().equalsIgnoreCase(email.trim());
    }
}
