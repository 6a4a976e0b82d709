package personal.bookly.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Bookly 설정 Properties
 * application.yml의 bookly.* 설정을 기동 시 한 번 바인딩
 */
@ConfigurationProperties(prefix = "bookly")
public record BooklyProperties(
        Booking booking,
        Schedule schedule,
        RateLimit rateLimit,
        Signal signal
) {
    public record Booking(
            int pastToleranceSeconds,
            int conflictRowLimit
    ) {}

    public record Schedule(
            boolean staffSchedulesEnabled  // false면 스태프 일정 미지원으로 응답하고 영업시간만 사용
    ) {}

    public record RateLimit(
            boolean enabled,
            int capacity,
            double refillRate  // Token Bucket: 초당 리필 토큰 수
    ) {}

    public record Signal(
            String heartbeatKeyPrefix,
            String bookingChangedTopic
    ) {}
}
