package personal.bookly.core.customer.application.port.out;

import personal.bookly.core.customer.domain.model.Customer;

import java.util.Optional;

/**
 * Customer Repository (Output Port)
 */
public interface CustomerRepository {

    /**
     * @param email 소문자로 정규화된 이메일
     */
    Optional<Customer> findByTenantIdAndEmail(Long tenantId, String email);

    Optional<Customer> findByIdAndTenantId(Long customerId, Long tenantId);

    Customer save(Customer customer);
}
