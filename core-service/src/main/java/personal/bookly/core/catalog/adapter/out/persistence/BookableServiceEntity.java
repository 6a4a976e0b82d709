package personal.bookly.core.catalog.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.bookly.core.catalog.domain.model.AvailabilityBasis;
import personal.bookly.core.catalog.domain.model.BookableService;

/**
 * Service JPA Entity (읽기 전용)
 */
@Entity
@Table(name = "services")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BookableServiceEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(name = "duration_minutes", nullable = false)
    private Integer durationMinutes;

    @Column(name = "slot_interval_minutes")
    private Integer slotIntervalMinutes;

    @Column(name = "max_parallel_bookings", nullable = false)
    private Integer maxParallelBookings;

    @Column(name = "max_consecutive_slots")
    private Integer maxConsecutiveSlots;

    @Column(name = "requires_staff", nullable = false)
    private boolean requiresStaff;

    @Column(name = "requires_resource", nullable = false)
    private boolean requiresResource;

    @Column(name = "requires_confirmation", nullable = false)
    private boolean requiresConfirmation;

    @Column(name = "allow_membership", nullable = false)
    private boolean allowMembership;

    @Column(name = "availability_basis", length = 20)
    private String availabilityBasis;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    public BookableService toDomain() {
        return new BookableService(
                id,
                tenantId,
                name,
                durationMinutes,
                slotIntervalMinutes,
                maxParallelBookings == null ? 1 : maxParallelBookings,
                maxConsecutiveSlots,
                requiresStaff,
                requiresResource,
                requiresConfirmation,
                allowMembership,
                AvailabilityBasis.fromColumn(availabilityBasis),
                active
        );
    }
}
