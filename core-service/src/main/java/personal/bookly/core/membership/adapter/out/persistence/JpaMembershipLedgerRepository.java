package personal.bookly.core.membership.adapter.out.persistence;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import personal.bookly.core.membership.domain.model.LedgerEntryType;

import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA Repository for Membership Ledger
 */
public interface JpaMembershipLedgerRepository extends JpaRepository<MembershipLedgerEntity, Long> {

    @Query("""
            select coalesce(sum(l.minutesDelta), 0) as minutes, coalesce(sum(l.usesDelta), 0) as uses
            from MembershipLedgerEntity l
            where l.customerMembershipId = :membershipId
            """)
    LedgerSum sumByMembership(@Param("membershipId") Long membershipId);

    @Query("""
            select l from MembershipLedgerEntity l
            where l.tenantId = :tenantId and l.customerMembershipId = :membershipId
            order by l.createdAt desc, l.id desc
            """)
    List<MembershipLedgerEntity> findRecent(@Param("tenantId") Long tenantId,
                                            @Param("membershipId") Long membershipId,
                                            Pageable pageable);

    Optional<MembershipLedgerEntity> findFirstByTenantIdAndBookingIdAndEntryTypeOrderByIdAsc(
            Long tenantId, Long bookingId, LedgerEntryType entryType);

    /**
     * 원장 합계 프로젝션
     */
    interface LedgerSum {
        Long getMinutes();

        Long getUses();
    }
}
