package personal.bookly.core.membership.domain.model;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;

import java.time.Instant;

/**
 * Membership Ledger Entry (append-only)
 * GRANT는 0 이상의 증가분, DEBIT은 0 이하의 차감분이며 둘 다 0인 DEBIT은 허용하지 않는다
 */
public record MembershipLedgerEntry(
        Long id,
        Long tenantId,
        Long customerMembershipId,
        Long bookingId,
        LedgerEntryType entryType,
        int minutesDelta,
        int usesDelta,
        String note,
        Instant createdAt) {
    public MembershipLedgerEntry {
        if (tenantId == null || customerMembershipId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Tenant and membership are required for a ledger entry");
        }
        if (entryType == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Ledger entry type cannot be null");
        }
        if (entryType == LedgerEntryType.DEBIT) {
            if (minutesDelta > 0 || usesDelta > 0) {
                throw new BusinessException(ErrorCode.INVALID_INPUT, "Debit deltas must not be positive");
            }
            if (minutesDelta == 0 && usesDelta == 0) {
                throw new BusinessException(ErrorCode.INVALID_INPUT, "Debit must change at least one balance");
            }
        } else if (minutesDelta < 0 || usesDelta < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Grant deltas must not be negative");
        }
    }

    public static MembershipLedgerEntry grant(CustomerMembership membership, MembershipPlan plan, Instant now) {
        return new MembershipLedgerEntry(null, membership.tenantId(), membership.id(), null, LedgerEntryType.GRANT,
                plan.includedMinutes(), plan.includedUses(), "Initial grant for " + plan.name(), now);
    }

    public static MembershipLedgerEntry debit(Long tenantId, EntitlementDebit debit, Long bookingId, String note, Instant now) {
        return new MembershipLedgerEntry(null, tenantId, debit.membershipId(), bookingId, LedgerEntryType.DEBIT,
                debit.minutesDelta(), debit.usesDelta(), note, now);
    }
}
