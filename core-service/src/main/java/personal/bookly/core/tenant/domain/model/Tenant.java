package personal.bookly.core.tenant.domain.model;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Tenant Domain Model
 * 모든 예약 데이터의 소유자, 시간대 기준으로 로컬 날짜/분을 해석
 */
public record Tenant(
        Long id,
        String slug,
        ZoneId zoneId,
        String currency,
        boolean requirePhone) {
    public Tenant {
        if (id == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Tenant ID cannot be null");
        }
        if (slug == null || slug.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Tenant slug cannot be blank");
        }
        if (zoneId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Tenant timezone cannot be null");
        }
    }

    /**
     * 로컬 날짜 + 자정 기준 분 -> Instant
     * 1440 이상(자정 이후)은 다음날 벽시계 시각으로 계산
     */
    public Instant instantAt(LocalDate date, int minuteOfDay) {
        return date.atStartOfDay().plusMinutes(minuteOfDay).atZone(zoneId).toInstant();
    }

    public LocalDate localDateOf(Instant instant) {
        return instant.atZone(zoneId).toLocalDate();
    }
}
