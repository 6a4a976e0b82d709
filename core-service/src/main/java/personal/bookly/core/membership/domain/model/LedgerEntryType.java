package personal.bookly.core.membership.domain.model;

import java.util.Locale;

/**
 * 원장 항목 유형
 */
public enum LedgerEntryType {
    GRANT,
    DEBIT;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
