package com.example.webhookscheduler.service.lock;

import com.example.webhookscheduler.config.MetricsConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Lock backend on Redis {@code SET key owner NX EX ttl}.
 * <p>
 * Release runs a compare-and-delete script so a holder whose lock expired and was retaken
 * by another instance never deletes the new owner's key.
 */
@Slf4j
public class RedisLockCoordinator implements LockCoordinator {

    static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>("""
            if redis.call('get', KEYS[1]) == ARGV[1] then
                return redis.call('del', KEYS[1])
            end
            return 0
            """, Long.class);

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;
    private final String instanceId;
    private final MetricsConfig metricsConfig;

    public RedisLockCoordinator(StringRedisTemplate redisTemplate, String keyPrefix, InstanceIdentity identity, MetricsConfig metricsConfig) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix;
        this.instanceId = identity.getInstanceId();
        this.metricsConfig = metricsConfig;
    }

    @Override
    public boolean tryAcquire(UUID scheduleId, Duration ttl) {
        try {
            var acquired = Boolean.TRUE.equals(redisTemplate.opsForValue().setIfAbsent(key(scheduleId), instanceId, ttl));
            if (!acquired) {
                log.debug("Schedule {} is locked by another instance", scheduleId);
                metricsConfig.recordLockContention(getBackendName());
            }
            return acquired;
        } catch (DataAccessException e) {
            // treated as contention, the schedule stays due for the next tick
            log.warn("Redis unavailable while locking schedule {}: {}", scheduleId, e.getMessage());
            metricsConfig.recordLockError(getBackendName());
            return false;
        }
    }

    @Override
    public void release(UUID scheduleId) {
        try {
            var deleted = redisTemplate.execute(RELEASE_SCRIPT, List.of(key(scheduleId)), instanceId);
            if (deleted == null || deleted == 0L) {
                log.warn("Lock for schedule {} had already expired or changed owner before release", scheduleId);
            }
        } catch (DataAccessException e) {
            log.warn("Failed to release lock for schedule {}, it will expire by TTL: {}", scheduleId, e.getMessage());
            metricsConfig.recordLockError(getBackendName());
        }
    }

    @Override
    public String getBackendName() {
        return "redis";
    }

    String key(UUID scheduleId) {
        return keyPrefix + scheduleId;
    }
}
