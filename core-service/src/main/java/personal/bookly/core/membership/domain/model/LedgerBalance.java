package personal.bookly.core.membership.domain.model;

/**
 * 원장 합계 (minutes_delta / uses_delta 합)
 */
public record LedgerBalance(long minutes, long uses) {

    public boolean isNegative() {
        return minutes < 0 || uses < 0;
    }
}
