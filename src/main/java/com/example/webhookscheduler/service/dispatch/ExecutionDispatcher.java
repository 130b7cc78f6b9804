package com.example.webhookscheduler.service.dispatch;

import com.example.webhookscheduler.config.MetricsConfig;
import com.example.webhookscheduler.domain.entity.Run;
import com.example.webhookscheduler.exception.DispatchException;
import com.example.webhookscheduler.service.queue.QueuedTask;
import com.example.webhookscheduler.service.queue.TaskQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

/**
 * Hands a queued run to the task queue.
 * <p>
 * Called inside the transaction that created the run. A {@link DispatchException} is propagated
 * unchanged so that transaction rolls back and no run row survives without a queue entry.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionDispatcher {

    private final TaskQueue taskQueue;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    /**
     * Enqueue the run, delayed until its scheduled_for instant
     */
    public void dispatch(Run run) {
        var delay = Duration.between(clock.instant(), run.getScheduledFor());
        if (delay.isNegative()) {
            delay = Duration.ZERO;
        }

        try {
            taskQueue.enqueue(QueuedTask.from(run), delay);
            log.info("Dispatched run {} of schedule {} (attempt {}, occurrence {}, delay {}s)",
                    run.getId(), run.getScheduleId(), run.getAttempt(), run.getRunAt(), delay.toSeconds());
        } catch (DispatchException e) {
            log.error("Dispatch failed for run {} of schedule {}: {}", run.getId(), run.getScheduleId(), e.getMessage());
            metricsConfig.recordDispatchFailure(run.getAttempt() > 1 ? "retry" : "poller");
            throw e;
        }
    }
}
