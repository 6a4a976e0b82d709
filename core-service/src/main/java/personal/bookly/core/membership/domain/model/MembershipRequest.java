package personal.bookly.core.membership.domain.model;

/**
 * 예약 생성 시 이용권 사용 요청
 *
 * @param customerMembershipId 명시적으로 지정한 이용권 (잠금 후 검증, 실패 시 오류)
 * @param autoConsume          자동 선택 (대상이 없으면 이용권 없이 예약)
 * @param required             자동 선택 + 필수 (대상이 없으면 409)
 */
public record MembershipRequest(Long customerMembershipId, boolean autoConsume, boolean required) {

    public static MembershipRequest none() {
        return new MembershipRequest(null, false, false);
    }

    public boolean isRequested() {
        return customerMembershipId != null || autoConsume || required;
    }

    public boolean isExplicit() {
        return customerMembershipId != null;
    }

    /**
     * 실패 시 예약 자체를 거절해야 하는 요청인지
     */
    public boolean isHard() {
        return isExplicit() || required;
    }
}
