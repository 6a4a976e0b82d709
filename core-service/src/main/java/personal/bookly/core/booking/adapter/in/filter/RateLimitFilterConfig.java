package personal.bookly.core.booking.adapter.in.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import personal.bookly.core.config.BooklyProperties;

import java.time.Clock;

/**
 * 예약 생성 Rate Limit 필터 등록
 * bookly.rate-limit.enabled=false 이면 등록하지 않는다
 */
@Configuration
@ConditionalOnProperty(prefix = "bookly.rate-limit", name = "enabled", havingValue = "true")
public class RateLimitFilterConfig {

    @Bean
    public FilterRegistrationBean<BookingRateLimitFilter> bookingRateLimitFilter(StringRedisTemplate redisTemplate,
                                                                                 BooklyProperties properties,
                                                                                 ObjectMapper objectMapper,
                                                                                 Clock clock) {
        FilterRegistrationBean<BookingRateLimitFilter> registration = new FilterRegistrationBean<>(
                new BookingRateLimitFilter(redisTemplate, properties.rateLimit(), objectMapper, clock));
        registration.addUrlPatterns("/api/v1/bookings");
        registration.setName("bookingRateLimitFilter");
        return registration;
    }
}
