package personal.bookly.core.membership.domain.service;

import org.springframework.stereotype.Component;
import personal.bookly.core.membership.domain.model.CustomerMembership;
import personal.bookly.core.membership.domain.model.EntitlementDebit;

import java.util.Optional;

/**
 * 예약 차감 정책
 * 남은 분이 예약 시간을 감당하면 분 차감, 아니면 1회 차감, 둘 다 안 되면 차감 불가
 */
@Component
public class DebitPolicy {

    public Optional<EntitlementDebit> forBooking(CustomerMembership membership, int durationMinutes) {
        if (durationMinutes > 0 && membership.minutesRemaining() >= durationMinutes) {
            return Optional.of(EntitlementDebit.minutes(membership.id(), durationMinutes));
        }
        if (membership.usesRemaining() >= 1) {
            return Optional.of(EntitlementDebit.oneUse(membership.id()));
        }
        return Optional.empty();
    }
}
