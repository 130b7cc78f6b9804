package com.example.webhookscheduler.config;

import com.example.webhookscheduler.domain.repository.ScheduleRepository;
import com.example.webhookscheduler.service.lock.DatabaseLockCoordinator;
import com.example.webhookscheduler.service.lock.InstanceIdentity;
import com.example.webhookscheduler.service.lock.LockCoordinator;
import com.example.webhookscheduler.service.lock.RedisLockCoordinator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * Chooses the lock backend.
 * <p>
 * - redis: Redis SET NX EX, fails startup when no Redis template exists
 * - database: CAS on the schedule row
 * - auto: Redis when it answers a PING at startup, database otherwise
 */
@Slf4j
@Configuration
public class LockCoordinatorConfig {

    @Bean
    public LockCoordinator lockCoordinator(WebhookSchedulerProperties properties,
                                           ObjectProvider<StringRedisTemplate> redisTemplateProvider,
                                           ScheduleRepository scheduleRepository,
                                           InstanceIdentity identity,
                                           Clock clock,
                                           MetricsConfig metricsConfig) {
        var lock = properties.getLock();
        var redisTemplate = redisTemplateProvider.getIfAvailable();

        var useRedis = switch (lock.getBackend()) {
            case REDIS -> {
                if (redisTemplate == null) {
                    throw new IllegalStateException("Lock backend 'redis' requires a configured Redis connection");
                }
                yield true;
            }
            case DATABASE -> false;
            case AUTO -> redisTemplate != null && isReachable(redisTemplate);
        };

        if (useRedis) {
            log.info("Using Redis lock backend (key prefix '{}', ttl {}s)", lock.getKeyPrefix(), lock.getTtlSeconds());
            return new RedisLockCoordinator(redisTemplate, lock.getKeyPrefix(), identity, metricsConfig);
        }
        log.info("Using database lock backend (ttl {}s)", lock.getTtlSeconds());
        return new DatabaseLockCoordinator(scheduleRepository, identity, clock, metricsConfig);
    }

    private boolean isReachable(StringRedisTemplate redisTemplate) {
        try {
            var pong = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
            return "PONG".equalsIgnoreCase(pong);
        } catch (DataAccessException e) {
            log.warn("Redis not reachable at startup, falling back to database locks: {}", e.getMessage());
            return false;
        }
    }
}
