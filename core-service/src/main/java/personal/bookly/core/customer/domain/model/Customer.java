package personal.bookly.core.customer.domain.model;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;

import java.util.Locale;

/**
 * Customer Domain Model
 * 테넌트별 고객, 인증된 이메일로 식별
 */
public record Customer(
        Long id,
        Long tenantId,
        String name,
        String phone,
        String email
) {
    public Customer {
        if (tenantId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Tenant ID cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Customer name cannot be null or blank");
        }
        if (email == null || email.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Customer email cannot be null or blank");
        }
        email = normalizeEmail(email);
    }

    public static Customer create(Long tenantId, String name, String phone, String email) {
        return new Customer(null, tenantId, name, blankToNull(phone), email);
    }

    public boolean hasPhone() {
        return phone != null && !phone.isBlank();
    }

    /**
     * 저장된 전화번호가 없을 때만 새 번호로 채운다
     */
    public Customer withPhoneIfMissing(String newPhone) {
        if (hasPhone() || blankToNull(newPhone) == null) {
            return this;
        }
        return new Customer(id, tenantId, name, newPhone.trim(), email);
    }

    public boolean ownsEmail(String otherEmail) {
        return otherEmail != null && email.equals(normalizeEmail(otherEmail));
    }

    public static String normalizeEmail(String raw) {
        return raw.trim().toLowerCase(Locale.ROOT);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
