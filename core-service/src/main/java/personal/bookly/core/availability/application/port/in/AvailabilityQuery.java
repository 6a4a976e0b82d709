package personal.bookly.core.availability.application.port.in;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;

import java.time.LocalDate;

/**
 * 하루치 가용성 조회 조건
 *
 * @param staffId    선택 (기준에 스태프가 포함되면 필수)
 * @param resourceId 선택 (기준에 리소스가 포함되면 필수)
 */
public record AvailabilityQuery(
        String tenantSlug,
        Long serviceId,
        LocalDate date,
        Long staffId,
        Long resourceId) {
    public AvailabilityQuery {
        if (tenantSlug == null || tenantSlug.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "tenant is required.");
        }
        if (serviceId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "service is required.");
        }
        if (date == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "date is required.");
        }
    }
}
