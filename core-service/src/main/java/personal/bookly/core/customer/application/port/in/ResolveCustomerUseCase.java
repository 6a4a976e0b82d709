package personal.bookly.core.customer.application.port.in;

import personal.bookly.core.customer.domain.model.Customer;

/**
 * Resolve Customer UseCase (Input Port)
 */
public interface ResolveCustomerUseCase {

    /**
     * 인증된 이메일로 고객 조회, 없으면 생성
     * 기존 고객의 이름/전화번호가 우선하며 전화번호가 비어 있을 때만 요청 값으로 채운다
     */
    Customer resolve(ResolveCustomerCommand command);

    /**
     * @throws personal.bookly.core.customer.domain.exception.CustomerNotFoundException 테넌트 소속 고객이 아닐 때
     */
    Customer getCustomer(Long tenantId, Long customerId);
}
