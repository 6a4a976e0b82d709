package personal.bookly.core.customer.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.bookly.core.customer.application.port.out.CustomerRepository;
import personal.bookly.core.customer.domain.model.Customer;

import java.util.Optional;

/**
 * Customer Persistence Adapter
 * JPA를 사용한 고객 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CustomerPersistenceAdapter implements CustomerRepository {

    private final JpaCustomerRepository jpaCustomerRepository;

    @Override
    public Optional<Customer> findByTenantIdAndEmail(Long tenantId, String email) {
        log.debug("Finding customer by email: tenantId={}", tenantId);
        return jpaCustomerRepository.findByTenantIdAndEmail(tenantId, email)
                .map(CustomerEntity::toDomain);
    }

    @Override
    public Optional<Customer> findByIdAndTenantId(Long customerId, Long tenantId) {
        return jpaCustomerRepository.findByIdAndTenantId(customerId, tenantId)
                .map(CustomerEntity::toDomain);
    }

    @Override
    @Transactional
    public Customer save(Customer customer) {
        if (customer.id() == null) {
            return jpaCustomerRepository.saveAndFlush(CustomerEntity.fromDomain(customer)).toDomain();
        }
        CustomerEntity entity = jpaCustomerRepository.findById(customer.id())
                .orElseGet(() -> CustomerEntity.fromDomain(customer));
        entity.apply(customer);
        return jpaCustomerRepository.saveAndFlush(entity).toDomain();
    }
}
