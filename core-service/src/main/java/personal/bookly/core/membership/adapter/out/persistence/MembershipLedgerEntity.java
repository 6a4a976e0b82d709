package personal.bookly.core.membership.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.bookly.core.membership.domain.model.LedgerEntryType;
import personal.bookly.core.membership.domain.model.MembershipLedgerEntry;

import java.time.Instant;

/**
 * Membership Ledger JPA Entity
 * (customer_membership_id, booking_id, entry_type) 유니크 제약이 예약당 1회 차감을 보장
 */
@Entity
@Table(name = "membership_ledger",
        uniqueConstraints = @UniqueConstraint(name = "uk_membership_ledger_booking",
                columnNames = {"customer_membership_id", "booking_id", "entry_type"}))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class MembershipLedgerEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Column(name = "customer_membership_id", nullable = false)
    private Long customerMembershipId;

    @Column(name = "booking_id")
    private Long bookingId;

    @Enumerated(EnumType.STRING)
    @Column(name = "entry_type", nullable = false, length = 20)
    private LedgerEntryType entryType;

    @Column(name = "minutes_delta", nullable = false)
    private int minutesDelta;

    @Column(name = "uses_delta", nullable = false)
    private int usesDelta;

    @Column(length = 500)
    private String note;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static MembershipLedgerEntity fromDomain(MembershipLedgerEntry entry) {
        MembershipLedgerEntity entity = new MembershipLedgerEntity();
        entity.tenantId = entry.tenantId();
        entity.customerMembershipId = entry.customerMembershipId();
        entity.bookingId = entry.bookingId();
        entity.entryType = entry.entryType();
        entity.minutesDelta = entry.minutesDelta();
        entity.usesDelta = entry.usesDelta();
        entity.note = entry.note();
        entity.createdAt = entry.createdAt();
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public MembershipLedgerEntry toDomain() {
        return new MembershipLedgerEntry(id, tenantId, customerMembershipId, bookingId, entryType,
                minutesDelta, usesDelta, note, createdAt);
    }
}
