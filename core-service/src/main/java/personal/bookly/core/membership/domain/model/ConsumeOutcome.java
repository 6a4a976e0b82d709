package personal.bookly.core.membership.domain.model;

/**
 * consume-next 결과
 *
 * @param alreadyDebited 같은 예약에 대한 차감이 이미 있어 현재 상태만 반환한 경우
 */
public record ConsumeOutcome(CustomerMembership membership, boolean alreadyDebited) {
}
