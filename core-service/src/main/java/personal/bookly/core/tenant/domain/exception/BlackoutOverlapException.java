package personal.bookly.core.tenant.domain.exception;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;

import java.util.Map;

/**
 * Blackout Overlap Exception
 * 같은 범위의 활성 블랙아웃과 겹치는 경우
 * HTTP 409 Conflict 반환용
 */
public class BlackoutOverlapException extends BusinessException {
    public BlackoutOverlapException(Long existingBlackoutId) {
        super(ErrorCode.BLACKOUT_OVERLAP,
                String.format("Blackout overlaps existing blackout: blackoutId=%d", existingBlackoutId),
                Map.of("existingBlackoutId", existingBlackoutId));
    }
}
