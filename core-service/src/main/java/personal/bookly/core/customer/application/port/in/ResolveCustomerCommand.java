package personal.bookly.core.customer.application.port.in;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;

/**
 * Resolve Customer Command
 *
 * @param email       인증 게이트웨이가 전달한 이메일 (X-User-Email)
 * @param displayName 인증 게이트웨이가 전달한 이름 (X-User-Name), 없으면 요청 본문의 이름
 * @param phone       요청 본문의 전화번호 (선택)
 */
public record ResolveCustomerCommand(
        Long tenantId,
        String email,
        String displayName,
        String phone
) {
    public static final String DEFAULT_NAME = "Customer";

    public ResolveCustomerCommand {
        if (tenantId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Tenant ID cannot be null");
        }
        if (email == null || email.isBlank()) {
            throw new BusinessException(ErrorCode.UNAUTHORIZED, "Authenticated email is required");
        }
    }

    public String nameOrDefault() {
        return displayName == null || displayName.isBlank() ? DEFAULT_NAME : displayName.trim();
    }
}
