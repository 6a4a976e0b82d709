package personal.bookly.core.tenant.adapter.out.redis;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.scripting.support.ResourceScriptSource;
import org.springframework.stereotype.Component;
import personal.bookly.core.config.BooklyProperties;
import personal.bookly.core.tenant.application.port.out.TenantHeartbeatPort;

import java.time.Instant;
import java.util.Collections;
import java.util.Optional;

/**
 * Redis Tenant Heartbeat Adapter
 * Key: {prefix}{tenantId}, Value: 마지막 예약 변경 시각 (epoch millis)
 * 더 늦은 시각만 기록한다 (Lua compare-and-set)
 */
@Slf4j
@Component
public class RedisTenantHeartbeatAdapter implements TenantHeartbeatPort {

    private final StringRedisTemplate redisTemplate;
    private final BooklyProperties properties;
    private final DefaultRedisScript<Long> bumpScript;

    public RedisTenantHeartbeatAdapter(StringRedisTemplate redisTemplate, BooklyProperties properties) {
        this.redisTemplate = redisTemplate;
        this.properties = properties;

        this.bumpScript = new DefaultRedisScript<>();
        this.bumpScript.setScriptSource(
                new ResourceScriptSource(new ClassPathResource("scripts/heartbeat_bump.lua"))
        );
        this.bumpScript.setResultType(Long.class);
    }

    @Override
    public void bump(Long tenantId, Instant changedAt) {
        Long stored = redisTemplate.execute(
                bumpScript,
                Collections.singletonList(key(tenantId)),
                String.valueOf(changedAt.toEpochMilli())
        );
        if (stored != null && stored == 1L) {
            log.debug("Heartbeat bumped: tenantId={}, changedAt={}", tenantId, changedAt);
        } else {
            log.debug("Heartbeat kept newer value: tenantId={}, changedAt={}", tenantId, changedAt);
        }
    }

    @Override
    public Optional<Instant> lastBookingChangeAt(Long tenantId) {
        String value = redisTemplate.opsForValue().get(key(tenantId));
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.ofEpochMilli(Long.parseLong(value)));
        } catch (NumberFormatException e) {
            log.warn("Malformed heartbeat value: tenantId={}, value={}", tenantId, value);
            return Optional.empty();
        }
    }

    private String key(Long tenantId) {
        return properties.signal().heartbeatKeyPrefix() + tenantId;
    }
}
