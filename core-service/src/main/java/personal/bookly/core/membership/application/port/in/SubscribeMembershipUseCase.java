package personal.bookly.core.membership.application.port.in;

import personal.bookly.core.membership.domain.model.SubscribeOutcome;

/**
 * Subscribe Membership UseCase (Input Port)
 */
public interface SubscribeMembershipUseCase {

    SubscribeOutcome subscribe(SubscribeMembershipCommand command);
}
