package personal.bookly.core.booking.domain.model;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Booking Status Enum
 * 전이 규칙: PENDING -> {CONFIRMED, CANCELLED}, CONFIRMED -> {CANCELLED}, CANCELLED는 종료 상태
 * 같은 상태로의 전이는 허용 (멱등 no-op)
 */
public enum BookingStatus {
    /**
     * 승인 대기 (서비스가 확인을 요구하는 경우)
     */
    PENDING,

    /**
     * 확정
     */
    CONFIRMED,

    /**
     * 취소 (종료)
     */
    CANCELLED;

    /**
     * 시간을 점유하는 상태 (겹침 계산 대상)
     */
    public static final List<BookingStatus> OCCUPYING = List.of(PENDING, CONFIRMED);

    public boolean canTransitionTo(BookingStatus target) {
        return this == target || allowedTargets().contains(target);
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * 대소문자 구분 없이 파싱
     *
     * @throws BusinessException 알 수 없는 상태 (400)
     */
    public static BookingStatus from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Invalid status.");
        }
        try {
            return BookingStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Invalid status.");
        }
    }

    private Set<BookingStatus> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(CONFIRMED, CANCELLED);
            case CONFIRMED -> EnumSet.of(CANCELLED);
            case CANCELLED -> EnumSet.noneOf(BookingStatus.class);
        };
    }
}
