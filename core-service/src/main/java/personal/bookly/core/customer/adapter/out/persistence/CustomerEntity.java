package personal.bookly.core.customer.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.bookly.core.customer.domain.model.Customer;

import java.time.Instant;

/**
 * Customer JPA Entity
 */
@Entity
@Table(name = "customers",
        uniqueConstraints = @UniqueConstraint(name = "uk_customers_tenant_email", columnNames = {"tenant_id", "email"}))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CustomerEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(length = 50)
    private String phone;

    @Column(nullable = false, length = 320)
    private String email;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static CustomerEntity fromDomain(Customer customer) {
        CustomerEntity entity = new CustomerEntity();
        entity.id = customer.id();
        entity.tenantId = customer.tenantId();
        entity.name = customer.name();
        entity.phone = customer.phone();
        entity.email = customer.email();
        return entity;
    }

    /**
     * 기존 행에 도메인 변경 사항 반영 (created_at 유지)
     */
    public void apply(Customer customer) {
        this.name = customer.name();
        this.phone = customer.phone();
    }

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }

    public Customer toDomain() {
        return new Customer(id, tenantId, name, phone, email);
    }
}
