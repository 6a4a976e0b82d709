package personal.bookly.core.booking.adapter.in.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.scripting.support.ResourceScriptSource;
import org.springframework.web.filter.OncePerRequestFilter;
import personal.bookly.common.exception.ErrorCode;
import personal.bookly.common.exception.ErrorResponse;
import personal.bookly.core.config.BooklyProperties;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Collections;
import java.util.Locale;

/**
 * Booking Rate Limit Filter
 * Redis 기반 Token Bucket 알고리즘으로 예약 생성(POST /api/v1/bookings) 요청 제한
 * Lua Script로 리필/소비를 원자적으로 처리
 *
 * 키: rate_limit:booking:{tenant}:{인증 이메일 또는 원격 주소}
 * Redis 장애 시 요청을 허용한다 (Fail-open)
 */
@Slf4j
public class BookingRateLimitFilter extends OncePerRequestFilter {

    private static final String RATE_LIMIT_KEY_PREFIX = "rate_limit:booking:";
    private static final String BOOKINGS_PATH = "/api/v1/bookings";
    private static final String USER_EMAIL_HEADER = "X-User-Email";

    private final StringRedisTemplate redisTemplate;
    private final BooklyProperties.RateLimit config;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final DefaultRedisScript<Long> rateLimitScript;

    public BookingRateLimitFilter(StringRedisTemplate redisTemplate,
                                  BooklyProperties.RateLimit config,
                                  ObjectMapper objectMapper,
                                  Clock clock) {
        this.redisTemplate = redisTemplate;
        this.config = config;
        this.objectMapper = objectMapper;
        this.clock = clock;

        this.rateLimitScript = new DefaultRedisScript<>();
        this.rateLimitScript.setScriptSource(
                new ResourceScriptSource(new ClassPathResource("scripts/rate_limit_check.lua"))
        );
        this.rateLimitScript.setResultType(Long.class);

        log.info("BookingRateLimitFilter initialized: capacity={}, refillRate={}",
                config.capacity(), config.refillRate());
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !(HttpMethod.POST.matches(request.getMethod()) && BOOKINGS_PATH.equals(request.getRequestURI()));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String tenant = request.getParameter("tenant");
        String caller = request.getHeader(USER_EMAIL_HEADER);
        if (caller == null || caller.isBlank()) {
            caller = request.getRemoteAddr();
        }

        if (!checkRateLimit(tenant == null ? "-" : tenant, caller.trim().toLowerCase(Locale.ROOT))) {
            log.warn("Booking rate limit exceeded: tenant={}", tenant);
            writeTooManyRequests(response);
            return;
        }

        filterChain.doFilter(request, response);
    }

    /**
     * @return true: 요청 허용, false: 요청 거부
     */
    private boolean checkRateLimit(String tenant, String caller) {
        String key = RATE_LIMIT_KEY_PREFIX + tenant + ":" + caller;
        try {
            double currentTime = clock.millis() / 1000.0;

            // KEYS[1]: key, ARGV[1]: capacity, ARGV[2]: refill rate, ARGV[3]: now (epoch seconds)
            Long result = redisTemplate.execute(
                    rateLimitScript,
                    Collections.singletonList(key),
                    String.valueOf(config.capacity()),
                    String.valueOf(config.refillRate()),
                    String.valueOf(currentTime)
            );
            return result != null && result == 1L;

        } catch (Exception e) {
            log.warn("Rate limit check failed, allowing request: tenant={}, error={}", tenant, e.getMessage());
            return true;
        }
    }

    private void writeTooManyRequests(HttpServletResponse response) throws IOException {
        response.setStatus(ErrorCode.RATE_LIMITED.getHttpStatus().value());

        // Retry-After: 토큰 1개가 리필되는 시간 (초)
        double retryAfterSeconds = config.refillRate() > 0 ? 1.0 / config.refillRate() : 1.0;
        response.setHeader("Retry-After", String.valueOf((int) Math.ceil(retryAfterSeconds)));

        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getWriter(),
                ErrorResponse.of(ErrorCode.RATE_LIMITED, ErrorCode.RATE_LIMITED.getMessage()));
    }
}
