package personal.bookly.core.tenant.application.port.in;

import personal.bookly.core.tenant.domain.model.Blackout;

import java.time.Instant;
import java.util.List;

/**
 * Check Blackout UseCase (Input Port)
 * 가용성 계산과 예약 생성이 공유하는 차단 구간 조회
 */
public interface CheckBlackoutUseCase {

    /**
     * [from, to)와 겹치고 서비스/스태프/리소스 범위에 적용되는 활성 블랙아웃
     */
    List<Blackout> findBlocking(Long tenantId, Instant from, Instant to,
                                Long serviceId, Long staffId, Long resourceId);
}
