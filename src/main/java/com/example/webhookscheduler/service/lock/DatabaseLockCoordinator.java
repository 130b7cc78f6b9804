package com.example.webhookscheduler.service.lock;

import com.example.webhookscheduler.config.MetricsConfig;
import com.example.webhookscheduler.domain.repository.ScheduleRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.UUID;

/**
 * Lock backend on the schedule row's locked_by / locked_until columns.
 * <p>
 * Acquisition is a compare-and-set update that succeeds only when the row is unlocked or its
 * lock has expired. Each call commits on its own so the claim is visible to other instances
 * before the occurrence transaction starts.
 */
@Slf4j
public class DatabaseLockCoordinator implements LockCoordinator {

    private final ScheduleRepository scheduleRepository;
    private final String instanceId;
    private final Clock clock;
    private final MetricsConfig metricsConfig;

    public DatabaseLockCoordinator(ScheduleRepository scheduleRepository, InstanceIdentity identity, Clock clock, MetricsConfig metricsConfig) {
        this.scheduleRepository = scheduleRepository;
        this.instanceId = identity.getInstanceId();
        this.clock = clock;
        this.metricsConfig = metricsConfig;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean tryAcquire(UUID scheduleId, Duration ttl) {
        var now = clock.instant();
        var updated = scheduleRepository.acquireLock(scheduleId, instanceId, now.plus(ttl), now);

        if (updated == 1) {
            log.debug("Acquired lock for schedule {} until {}", scheduleId, now.plus(ttl));
            return true;
        }
        log.debug("Failed to acquire lock for schedule {} (held by another instance)", scheduleId);
        metricsConfig.recordLockContention(getBackendName());
        return false;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void release(UUID scheduleId) {
        var updated = scheduleRepository.releaseLock(scheduleId, instanceId);
        if (updated == 0) {
            log.warn("Lock for schedule {} had already expired or changed owner before release", scheduleId);
        }
    }

    @Override
    public String getBackendName() {
        return "database";
    }
}
