package personal.bookly.core.membership.application.port.in;

import personal.bookly.core.membership.domain.model.ConsumeOutcome;

/**
 * Consume Membership UseCase (Input Port)
 */
public interface ConsumeMembershipUseCase {

    /**
     * 조건을 만족하는 이용권 하나를 골라 예약 기준으로 한 번만 차감
     *
     * @throws personal.bookly.core.membership.domain.exception.NoEligibleEntitlementException 대상 이용권이 없을 때
     */
    ConsumeOutcome consumeNext(ConsumeNextCommand command);
}
