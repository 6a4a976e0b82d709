package personal.bookly.core.membership.domain.model;

/**
 * 선택된 이용권과 차감량 (음수 delta)
 */
public record EntitlementDebit(Long membershipId, int minutesDelta, int usesDelta) {

    public static EntitlementDebit minutes(Long membershipId, int minutes) {
        return new EntitlementDebit(membershipId, -minutes, 0);
    }

    public static EntitlementDebit oneUse(Long membershipId) {
        return new EntitlementDebit(membershipId, 0, -1);
    }
}
