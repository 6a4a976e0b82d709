package personal.bookly.core.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.bookly.core.booking.domain.model.Booking;
import personal.bookly.core.booking.domain.model.BookingStatus;
import personal.bookly.core.booking.domain.model.OccupiedInterval;

import java.time.Instant;

/**
 * Booking JPA Entity
 * end_time은 start_time + duration 비정규화 값이며 겹침 쿼리에 사용된다
 */
@Entity
@Table(name = "bookings",
        uniqueConstraints = @UniqueConstraint(name = "uk_bookings_tenant_idempotency",
                columnNames = {"tenant_id", "idempotency_key"}),
        indexes = {
                @Index(name = "idx_bookings_staff_time", columnList = "tenant_id, staff_id, start_time"),
                @Index(name = "idx_bookings_resource_time", columnList = "tenant_id, resource_id, start_time"),
                @Index(name = "idx_bookings_service_time", columnList = "tenant_id, service_id, start_time")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BookingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Column(name = "service_id")
    private Long serviceId;

    @Column(name = "staff_id")
    private Long staffId;

    @Column(name = "resource_id")
    private Long resourceId;

    @Column(name = "customer_id")
    private Long customerId;

    @Column(name = "customer_name", length = 200)
    private String customerName;

    @Column(name = "customer_phone", length = 50)
    private String customerPhone;

    @Column(name = "customer_email", length = 320)
    private String customerEmail;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "duration_minutes", nullable = false)
    private int durationMinutes;

    @Column(name = "end_time", nullable = false)
    private Instant endTime;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private BookingStatus status;

    @Column(name = "idempotency_key", length = 200)
    private String idempotencyKey;

    @Column(name = "booking_code", length = 100)
    private String bookingCode;

    @Column(name = "customer_membership_id")
    private Long customerMembershipId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static BookingEntity fromDomain(Booking booking) {
        BookingEntity entity = new BookingEntity();
        entity.id = booking.id();
        entity.tenantId = booking.tenantId();
        entity.serviceId = booking.serviceId();
        entity.staffId = booking.staffId();
        entity.resourceId = booking.resourceId();
        entity.customerId = booking.customerId();
        entity.customerName = booking.customerName();
        entity.customerPhone = booking.customerPhone();
        entity.customerEmail = booking.customerEmail();
        entity.startTime = booking.startTime();
        entity.durationMinutes = booking.durationMinutes();
        entity.endTime = booking.endTime();
        entity.idempotencyKey = booking.idempotencyKey();
        entity.createdAt = booking.createdAt();
        entity.apply(booking);
        return entity;
    }

    /**
     * 저장 이후 변경 가능한 값: 상태, 예약 코드, 사용한 이용권
     */
    public void apply(Booking booking) {
        this.status = booking.status();
        this.bookingCode = booking.bookingCode();
        this.customerMembershipId = booking.customerMembershipId();
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public Booking toDomain() {
        return new Booking(id, tenantId, serviceId, staffId, resourceId, customerId,
                customerName, customerPhone, customerEmail, startTime, durationMinutes,
                status, idempotencyKey, bookingCode, customerMembershipId, createdAt);
    }

    public OccupiedInterval toInterval() {
        return new OccupiedInterval(id, serviceId, staffId, resourceId, startTime, endTime, status);
    }
}
