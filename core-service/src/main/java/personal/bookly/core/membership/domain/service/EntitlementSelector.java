package personal.bookly.core.membership.domain.service;

import org.springframework.stereotype.Component;
import personal.bookly.core.membership.domain.model.CustomerMembership;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Entitlement Selector
 * 사용 가능한 이용권 중 하나를 결정적으로 선택
 * 만료가 빠른 순(종료일 없음은 마지막) → 남은 분 많은 순 → 남은 횟수 많은 순 → id 오름차순
 */
@Component
public class EntitlementSelector {

    private static final Comparator<CustomerMembership> SELECTION_ORDER =
            Comparator.comparing(CustomerMembership::endAt, Comparator.nullsLast(Comparator.naturalOrder()))
                    .thenComparing(CustomerMembership::minutesRemaining, Comparator.reverseOrder())
                    .thenComparing(CustomerMembership::usesRemaining, Comparator.reverseOrder())
                    .thenComparing(CustomerMembership::id);

    public Optional<CustomerMembership> select(List<CustomerMembership> candidates, int minutes, int uses, Instant now) {
        return candidates.stream()
                .filter(m -> m.isUsableAt(now))
                .filter(m -> m.covers(minutes, uses))
                .min(SELECTION_ORDER);
    }
}
