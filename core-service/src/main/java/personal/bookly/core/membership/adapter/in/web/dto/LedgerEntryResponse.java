package personal.bookly.core.membership.adapter.in.web.dto;

import personal.bookly.core.membership.domain.model.MembershipLedgerEntry;

import java.time.Instant;

/**
 * Ledger Entry Response DTO
 */
public record LedgerEntryResponse(
        Long id,
        Long bookingId,
        String type,
        int minutesDelta,
        int usesDelta,
        String note,
        Instant createdAt
) {
    public static LedgerEntryResponse from(MembershipLedgerEntry entry) {
        return new LedgerEntryResponse(
                entry.id(),
                entry.bookingId(),
                entry.entryType().value(),
                entry.minutesDelta(),
                entry.usesDelta(),
                entry.note(),
                entry.createdAt()
        );
    }
}
