package personal.bookly.core.customer.domain.exception;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;

/**
 * Customer Not Found Exception
 * 고객을 찾을 수 없거나 다른 테넌트 소속일 때 발생
 */
public class CustomerNotFoundException extends BusinessException {
    public CustomerNotFoundException(Long customerId) {
        super(ErrorCode.CUSTOMER_NOT_FOUND, String.format("Customer not found: customerId=%d", customerId));
    }
}
