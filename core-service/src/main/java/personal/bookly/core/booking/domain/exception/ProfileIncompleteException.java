package personal.bookly.core.booking.domain.exception;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;

import java.util.List;
import java.util.Map;

/**
 * Profile Incomplete Exception
 * 테넌트 정책상 전화번호가 필요한데 고객 프로필에 없을 때 (409)
 */
public class ProfileIncompleteException extends BusinessException {
    public ProfileIncompleteException() {
        super(ErrorCode.PROFILE_INCOMPLETE, ErrorCode.PROFILE_INCOMPLETE.getMessage(), Map.of("fields", List.of("phone")));
    }
}
