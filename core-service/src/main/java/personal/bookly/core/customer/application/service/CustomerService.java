package personal.bookly.core.customer.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import personal.bookly.core.customer.application.port.in.ResolveCustomerCommand;
import personal.bookly.core.customer.application.port.in.ResolveCustomerUseCase;
import personal.bookly.core.customer.application.port.out.CustomerRepository;
import personal.bookly.core.customer.domain.exception.CustomerNotFoundException;
import personal.bookly.core.customer.domain.model.Customer;

/**
 * Customer Application Service
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CustomerService implements ResolveCustomerUseCase {

    private final CustomerRepository customerRepository;

    @Override
    public Customer resolve(ResolveCustomerCommand command) {
        String email = Customer.normalizeEmail(command.email());

        return customerRepository.findByTenantIdAndEmail(command.tenantId(), email)
                .map(existing -> fillPhone(existing, command.phone()))
                .orElseGet(() -> create(command, email));
    }

    @Override
    public Customer getCustomer(Long tenantId, Long customerId) {
        return customerRepository.findByIdAndTenantId(customerId, tenantId)
                .orElseThrow(() -> {
                    log.warn("Customer not found: tenantId={}, customerId={}", tenantId, customerId);
                    return new CustomerNotFoundException(customerId);
                });
    }

    private Customer fillPhone(Customer existing, String phone) {
        Customer updated = existing.withPhoneIfMissing(phone);
        if (updated == existing) {
            return existing;
        }
        log.info("Customer phone filled: tenantId={}, customerId={}", existing.tenantId(), existing.id());
        return customerRepository.save(updated);
    }

    private Customer create(ResolveCustomerCommand command, String email) {
        try {
            Customer created = customerRepository.save(
                    Customer.create(command.tenantId(), command.nameOrDefault(), command.phone(), email));
            log.info("Customer created: tenantId={}, customerId={}", created.tenantId(), created.id());
            return created;
        } catch (DataIntegrityViolationException e) {
            // 동시 생성 경합: (tenant_id, email) 유니크 제약 위반 시 기존 행 재조회
            log.debug("Concurrent customer creation: tenantId={}", command.tenantId());
            return customerRepository.findByTenantIdAndEmail(command.tenantId(), email)
                    .orElseThrow(() -> e);
        }
    }
}
