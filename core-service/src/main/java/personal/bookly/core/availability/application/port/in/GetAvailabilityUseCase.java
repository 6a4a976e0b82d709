package personal.bookly.core.availability.application.port.in;

import personal.bookly.core.availability.domain.model.DayAvailability;

/**
 * Get Availability UseCase (Input Port)
 */
public interface GetAvailabilityUseCase {

    /**
     * 테넌트 로컬 날짜의 슬롯 목록
     * 스태프/리소스 누락, 휴무, 근무 없음은 오류가 아니라 빈 슬롯 + reason 으로 응답
     */
    DayAvailability getAvailability(AvailabilityQuery query);
}
