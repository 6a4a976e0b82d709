package personal.bookly.core.membership.application.port.out;

import personal.bookly.core.membership.domain.model.LedgerBalance;
import personal.bookly.core.membership.domain.model.MembershipLedgerEntry;

import java.util.List;
import java.util.Optional;

/**
 * Membership Ledger Repository (Output Port)
 * 원장은 추가만 가능하다
 */
public interface MembershipLedgerRepository {

    /**
     * 즉시 flush 하여 (membership, booking, type) 유니크 위반을 트랜잭션 안에서 드러낸다
     */
    MembershipLedgerEntry append(MembershipLedgerEntry entry);

    LedgerBalance sumByMembership(Long membershipId);

    /**
     * 최신순, 최대 limit 건
     */
    List<MembershipLedgerEntry> findByMembership(Long tenantId, Long membershipId, int limit);

    Optional<MembershipLedgerEntry> findDebitForBooking(Long tenantId, Long bookingId);
}
