package personal.bookly.core.tenant.application.port.in;

import personal.bookly.core.tenant.domain.model.Blackout;

import java.time.Instant;
import java.util.List;

/**
 * Manage Blackout UseCase (Input Port)
 */
public interface ManageBlackoutUseCase {

    /**
     * 블랙아웃 생성
     *
     * @throws personal.bookly.core.tenant.domain.exception.BlackoutOverlapException 같은 범위의 활성 블랙아웃과 겹칠 때 (409)
     */
    Blackout create(CreateBlackoutCommand command);

    List<Blackout> list(String tenantSlug, Instant from, Instant to, boolean includeInactive);

    /**
     * 소프트 삭제 (is_active = false)
     */
    Blackout deactivate(String tenantSlug, Long blackoutId);
}
