package personal.bookly.core.tenant.domain.model;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;
import personal.bookly.common.time.SlotMath;
import personal.bookly.common.time.TimeWindow;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Optional;

/**
 * Tenant Hours Domain Model
 * 요일별 영업시간 (0=일요일 .. 6=토요일)
 */
public record TenantHours(
        Long id,
        Long tenantId,
        int dayOfWeek,
        LocalTime openTime,
        LocalTime closeTime,
        boolean closed) {
    public TenantHours {
        if (tenantId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Tenant ID cannot be null");
        }
        if (dayOfWeek < 0 || dayOfWeek > 6) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Day of week must be between 0 and 6: " + dayOfWeek);
        }
        if (!closed && (openTime == null || closeTime == null)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Open and close time are required when not closed");
        }
    }

    public static TenantHours closedDay(Long tenantId, int dayOfWeek) {
        return new TenantHours(null, tenantId, dayOfWeek, null, null, true);
    }

    /**
     * 0=일요일 기준 요일 인덱스
     */
    public static int dayIndexOf(LocalDate date) {
        return date.getDayOfWeek().getValue() % 7;
    }

    /**
     * 영업 창 (close <= open 이면 자정을 넘는 창)
     */
    public Optional<TimeWindow> window() {
        if (closed) {
            return Optional.empty();
        }
        return Optional.of(TimeWindow.overnightAware(
                SlotMath.toMinutes(openTime),
                SlotMath.toMinutes(closeTime)));
    }

    public TenantHours update(LocalTime newOpenTime, LocalTime newCloseTime, boolean newClosed) {
        return new TenantHours(id, tenantId, dayOfWeek, newOpenTime, newCloseTime, newClosed);
    }
}
