package personal.bookly.core.membership.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import personal.bookly.core.membership.application.port.out.MembershipLedgerRepository;
import personal.bookly.core.membership.domain.model.LedgerBalance;
import personal.bookly.core.membership.domain.model.LedgerEntryType;
import personal.bookly.core.membership.domain.model.MembershipLedgerEntry;

import java.util.List;
import java.util.Optional;

/**
 * Membership Ledger Persistence Adapter
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MembershipLedgerPersistenceAdapter implements MembershipLedgerRepository {

    private final JpaMembershipLedgerRepository jpaRepository;

    @Override
    public MembershipLedgerEntry append(MembershipLedgerEntry entry) {
        log.debug("Appending ledger entry: membershipId={}, bookingId={}, type={}",
                entry.customerMembershipId(), entry.bookingId(), entry.entryType());
        return jpaRepository.saveAndFlush(MembershipLedgerEntity.fromDomain(entry)).toDomain();
    }

    @Override
    public LedgerBalance sumByMembership(Long membershipId) {
        JpaMembershipLedgerRepository.LedgerSum sum = jpaRepository.sumByMembership(membershipId);
        long minutes = sum == null || sum.getMinutes() == null ? 0L : sum.getMinutes();
        long uses = sum == null || sum.getUses() == null ? 0L : sum.getUses();
        return new LedgerBalance(minutes, uses);
    }

    @Override
    public List<MembershipLedgerEntry> findByMembership(Long tenantId, Long membershipId, int limit) {
        return jpaRepository.findRecent(tenantId, membershipId, PageRequest.of(0, limit)).stream()
                .map(MembershipLedgerEntity::toDomain)
                .toList();
    }

    @Override
    public Optional<MembershipLedgerEntry> findDebitForBooking(Long tenantId, Long bookingId) {
        return jpaRepository.findFirstByTenantIdAndBookingIdAndEntryTypeOrderByIdAsc(
                        tenantId, bookingId, LedgerEntryType.DEBIT)
                .map(MembershipLedgerEntity::toDomain);
    }
}
