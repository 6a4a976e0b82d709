package personal.bookly.core.membership.domain.model;

/**
 * 구독 결과
 *
 * @param alreadyActive 같은 플랜의 유효한 이용권이 이미 있어 그대로 반환한 경우
 */
public record SubscribeOutcome(CustomerMembership membership, boolean alreadyActive) {
}
