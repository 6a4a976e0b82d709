package personal.bookly.core.customer.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

/**
 * Spring Data JPA Repository for Customer
 */
public interface JpaCustomerRepository extends JpaRepository<CustomerEntity, Long> {

    Optional<CustomerEntity> findByTenantIdAndEmail(Long tenantId, String email);

    Optional<CustomerEntity> findByIdAndTenantId(Long id, Long tenantId);
}
