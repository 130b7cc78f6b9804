package com.example.webhookscheduler.service.retry;

import com.example.webhookscheduler.config.MetricsConfig;
import com.example.webhookscheduler.config.WebhookSchedulerProperties;
import com.example.webhookscheduler.domain.enums.RunStatus;
import com.example.webhookscheduler.domain.repository.RunRepository;
import com.example.webhookscheduler.exception.DispatchException;
import com.example.webhookscheduler.exception.RunNotFoundException;
import com.example.webhookscheduler.service.dispatch.ExecutionDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Recovers runs whose worker went away.
 * <p>
 * - RUNNING longer than the hard timeout: reported TIMED_OUT, so the normal retry rules apply
 * - QUEUED and overdue by the hard timeout: enqueued again; the queue is keyed by run id,
 *   so a run that is still queued is not duplicated
 * <p>
 * Runs on one instance at a time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StaleRunSweeper {

    private static final int SWEEP_BATCH_SIZE = 100;

    private final RunRepository runRepository;
    private final RetryStateMachine retryStateMachine;
    private final ExecutionDispatcher executionDispatcher;
    private final WebhookSchedulerProperties properties;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${webhook-scheduler.stale-run-check-interval-ms:60000}")
    @SchedulerLock(name = "staleRunSweeper", lockAtLeastFor = "10s", lockAtMostFor = "5m")
    public void sweep() {
        try {
            var timedOut = timeOutStuckRuns();
            var redispatched = redispatchLostRuns();
            if (timedOut > 0 || redispatched > 0) {
                log.info("Stale run sweep: {} timed out, {} re-dispatched", timedOut, redispatched);
            }
        } catch (DataAccessException e) {
            log.error("Error sweeping stale runs: {}", e.getMessage(), e);
        }
    }

    int timeOutStuckRuns() {
        var timeoutSeconds = properties.getRunHardTimeoutSeconds();
        var threshold = clock.instant().minusSeconds(timeoutSeconds);
        var stuck = runRepository.findStartedBefore(RunStatus.RUNNING, threshold, PageRequest.of(0, SWEEP_BATCH_SIZE));

        var count = 0;
        for (var run : stuck) {
            log.warn("Run {} of schedule {} has been running since {}, marking as timed out", run.getId(), run.getScheduleId(), run.getStartedAt());
            try {
                retryStateMachine.reportOutcome(OutcomeReport.builder()
                        .runId(run.getId())
                        .status(RunStatus.TIMED_OUT)
                        .workerId(run.getWorkerId())
                        .errorMessage(String.format("No outcome reported within %d seconds", timeoutSeconds))
                        .build());
                metricsConfig.recordStaleRun(RunStatus.RUNNING);
                count++;
            } catch (DispatchException | RunNotFoundException e) {
                log.warn("Could not time out run {}: {}", run.getId(), e.getMessage());
            }
        }
        return count;
    }

    int redispatchLostRuns() {
        var threshold = clock.instant().minusSeconds(properties.getRunHardTimeoutSeconds());
        var lost = runRepository.findScheduledBefore(RunStatus.QUEUED, threshold, PageRequest.of(0, SWEEP_BATCH_SIZE));

        var count = 0;
        for (var run : lost) {
            log.warn("Run {} of schedule {} was due at {} and never claimed, re-dispatching", run.getId(), run.getScheduleId(), run.getScheduledFor());
            try {
                executionDispatcher.dispatch(run);
                metricsConfig.recordStaleRun(RunStatus.QUEUED);
                count++;
            } catch (DispatchException e) {
                log.warn("Could not re-dispatch run {}: {}", run.getId(), e.getMessage());
            }
        }
        return count;
    }
}
