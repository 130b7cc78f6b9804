package com.example.webhookscheduler.service.poller;

import com.example.webhookscheduler.config.MetricsConfig;
import com.example.webhookscheduler.config.WebhookSchedulerProperties;
import com.example.webhookscheduler.domain.entity.Schedule;
import com.example.webhookscheduler.domain.repository.ScheduleRepository;
import com.example.webhookscheduler.exception.DispatchException;
import com.example.webhookscheduler.service.lock.LockCoordinator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic scan for due schedules.
 * <p>
 * Every instance runs its own poller; they coordinate only through the {@link LockCoordinator}.
 * <p>
 * Flow per tick:
 * 1. Fetch ACTIVE schedules with next_run_at <= now, oldest first, up to batch-size
 * 2. Process candidates concurrently on the poller executor
 * 3. Per candidate: try the lock, skip on contention, otherwise enqueue the occurrence
 * 4. Release the lock whatever happened
 * <p>
 * A failing candidate never stops the tick; it stays due and is retried on the next one.
 */
@Slf4j
@Service
public class DueSchedulePoller {

    private final ScheduleRepository scheduleRepository;
    private final LockCoordinator lockCoordinator;
    private final OccurrenceEnqueuer occurrenceEnqueuer;
    private final AdaptivePollInterval adaptivePollInterval;
    private final WebhookSchedulerProperties properties;
    private final MetricsConfig metricsConfig;
    private final Clock clock;
    private final ExecutorService pollerExecutor;

    private final AtomicBoolean isRunning = new AtomicBoolean(false);

    public DueSchedulePoller(ScheduleRepository scheduleRepository, LockCoordinator lockCoordinator, OccurrenceEnqueuer occurrenceEnqueuer,
                             AdaptivePollInterval adaptivePollInterval, WebhookSchedulerProperties properties, MetricsConfig metricsConfig,
                             Clock clock, @Qualifier("pollerExecutor") ExecutorService pollerExecutor) {
        this.scheduleRepository = scheduleRepository;
        this.lockCoordinator = lockCoordinator;
        this.occurrenceEnqueuer = occurrenceEnqueuer;
        this.adaptivePollInterval = adaptivePollInterval;
        this.properties = properties;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
        this.pollerExecutor = pollerExecutor;
    }

    /**
     * Run one polling cycle.
     *
     * @return number of occurrences enqueued by this instance
     */
    public int tick() {
        if (!isRunning.compareAndSet(false, true)) {
            log.debug("Previous polling cycle still running, skipping");
            return 0;
        }

        var timerSample = metricsConfig.startTimer();
        var candidateCount = 0;
        try {
            var candidates = scheduleRepository.findDueSchedules(clock.instant(), properties.getBatchSize());
            candidateCount = candidates.size();
            adaptivePollInterval.recordTick(candidateCount);

            if (candidates.isEmpty()) {
                log.debug("No schedules due");
                return 0;
            }

            log.debug("Found {} due schedules", candidates.size());

            var futures = candidates.stream()
                    .map(schedule -> CompletableFuture.supplyAsync(() -> processCandidate(schedule), pollerExecutor))
                    .toList();

            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            var enqueued = (int) futures.stream().filter(CompletableFuture::join).count();
            log.info("Polling cycle finished: {} due, {} enqueued", candidates.size(), enqueued);
            return enqueued;
        } catch (Exception e) {
            log.error("Error in polling cycle: {}", e.getMessage(), e);
            return 0;
        } finally {
            metricsConfig.recordTick(timerSample, candidateCount);
            isRunning.set(false);
        }
    }

    /**
     * Lock, enqueue and release one candidate
     */
    boolean processCandidate(Schedule schedule) {
        var scheduleId = schedule.getId();
        var ttl = Duration.ofSeconds(properties.getLock().getTtlSeconds());

        try {
            if (!lockCoordinator.tryAcquire(scheduleId, ttl)) {
                log.debug("Schedule {} locked elsewhere, skipping", scheduleId);
                return false;
            }
        } catch (DataAccessException e) {
            log.error("Storage error while locking schedule {}: {}", scheduleId, e.getMessage());
            return false;
        }

        try {
            return occurrenceEnqueuer.enqueueOccurrence(scheduleId).isPresent();
        } catch (DispatchException e) {
            log.warn("Occurrence of schedule {} rolled back, will retry next tick: {}", scheduleId, e.getMessage());
            return false;
        } catch (DataAccessException e) {
            log.error("Storage error for schedule {}, will retry next tick: {}", scheduleId, e.getMessage());
            return false;
        } catch (Exception e) {
            log.error("Error processing schedule {}: {}", scheduleId, e.getMessage(), e);
            return false;
        } finally {
            release(scheduleId);
        }
    }

    private void release(UUID scheduleId) {
        try {
            lockCoordinator.release(scheduleId);
        } catch (DataAccessException e) {
            log.warn("Failed to release lock for schedule {}, it will expire by TTL: {}", scheduleId, e.getMessage());
        }
    }
}
