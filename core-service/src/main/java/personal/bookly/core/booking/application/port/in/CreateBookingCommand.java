package personal.bookly.core.booking.application.port.in;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;
import personal.bookly.core.membership.domain.model.MembershipRequest;

import java.time.Instant;

/**
 * Create Booking Command
 * 고객 식별은 인증된 이메일로만 하며 클라이언트가 보낸 고객 id는 받지 않는다
 *
 * @param durationMinutes 서비스 기본 소요시간을 덮어쓸 값 (선택)
 * @param idempotencyKey  Idempotency-Key 헤더 (선택)
 */
public record CreateBookingCommand(
        String tenantSlug,
        Long serviceId,
        Long staffId,
        Long resourceId,
        Instant startTime,
        Integer durationMinutes,
        String customerEmail,
        String customerName,
        String customerPhone,
        String idempotencyKey,
        MembershipRequest membershipRequest
) {
    public static final int MAX_IDEMPOTENCY_KEY_LENGTH = 200;

    public CreateBookingCommand {
        if (tenantSlug == null || tenantSlug.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Tenant cannot be blank");
        }
        if (customerEmail == null || customerEmail.isBlank()) {
            throw new BusinessException(ErrorCode.UNAUTHORIZED, "Authenticated email is required");
        }
        if (serviceId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "serviceId is required.");
        }
        if (startTime == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "startTime is required.");
        }
        if (durationMinutes != null && durationMinutes <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "durationMinutes must be positive.");
        }
        if (idempotencyKey != null) {
            idempotencyKey = idempotencyKey.trim();
            if (idempotencyKey.isEmpty()) {
                idempotencyKey = null;
            } else if (idempotencyKey.length() > MAX_IDEMPOTENCY_KEY_LENGTH) {
                throw new BusinessException(ErrorCode.INVALID_INPUT, "Idempotency-Key is too long.");
            }
        }
        if (membershipRequest == null) {
            membershipRequest = MembershipRequest.none();
        }
    }

    public boolean hasIdempotencyKey() {
        return idempotencyKey != null;
    }
}
