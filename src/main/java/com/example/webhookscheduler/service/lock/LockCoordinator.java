package com.example.webhookscheduler.service.lock;

import java.time.Duration;
import java.util.UUID;

/**
 * Per-schedule mutual exclusion between scheduler instances.
 * <p>
 * Contention is not an error: {@link #tryAcquire} returns false and the caller skips the schedule.
 */
public interface LockCoordinator {

    /**
     * Claim the schedule for this instance without blocking.
     *
     * @param ttl expiry after which the claim lapses if never released
     * @return true when this instance now holds the lock
     */
    boolean tryAcquire(UUID scheduleId, Duration ttl);

    /**
     * Give up the claim. Has no effect when the lock expired and another instance took it.
     */
    void release(UUID scheduleId);

    /**
     * Short backend name for logs and metrics
     */
    String getBackendName();
}
