package com.example.webhookscheduler.service.worker;

import com.example.webhookscheduler.config.MetricsConfig;
import com.example.webhookscheduler.config.WebhookSchedulerProperties;
import com.example.webhookscheduler.exception.DispatchException;
import com.example.webhookscheduler.service.lock.InstanceIdentity;
import com.example.webhookscheduler.service.queue.QueuedTask;
import com.example.webhookscheduler.service.queue.TaskQueue;
import com.example.webhookscheduler.service.retry.RetryStateMachine;
import com.example.webhookscheduler.service.retry.RunClaim;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;

/**
 * In-process consumer of the task queue.
 * <p>
 * Flow:
 * 1. Claim at most as many due tasks as there are free worker slots
 * 2. Mark each run RUNNING; a run that is not QUEUED any more is a duplicate delivery and is dropped,
 *    a run that is not visible yet is put back on the queue after a short delay
 * 3. Call the webhook on the worker executor
 * 4. Report the outcome to the retry state machine
 * <p>
 * The scheduling thread only claims and hands off tasks; it never waits for webhook calls.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "webhook-scheduler.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WebhookWorker {

    private final TaskQueue taskQueue;
    private final RetryStateMachine retryStateMachine;
    private final WebhookInvoker webhookInvoker;
    private final WebhookSchedulerProperties properties;
    private final MetricsConfig metricsConfig;
    private final ExecutorService workerExecutor;
    private final String workerId;

    private final Semaphore slots;

    public WebhookWorker(TaskQueue taskQueue, RetryStateMachine retryStateMachine, WebhookInvoker webhookInvoker,
                         WebhookSchedulerProperties properties, MetricsConfig metricsConfig, InstanceIdentity identity,
                         @Qualifier("workerExecutor") ExecutorService workerExecutor) {
        this.taskQueue = taskQueue;
        this.retryStateMachine = retryStateMachine;
        this.webhookInvoker = webhookInvoker;
        this.properties = properties;
        this.metricsConfig = metricsConfig;
        this.workerExecutor = workerExecutor;
        this.workerId = identity.getInstanceId();
        this.slots = new Semaphore(properties.getWorker().getPoolSize());
    }

    /**
     * Claim a batch of due tasks and hand them to the worker executor.
     *
     * @return number of tasks handed off
     */
    @Scheduled(fixedDelayString = "${webhook-scheduler.worker.poll-interval-ms:1000}")
    public int pollAndExecute() {
        var free = slots.availablePermits();
        if (free == 0) {
            log.debug("All worker slots busy, skipping");
            return 0;
        }

        try {
            var tasks = taskQueue.poll(Math.min(properties.getWorker().getBatchSize(), free));
            if (tasks.isEmpty()) {
                return 0;
            }

            log.debug("Claimed {} tasks from the queue", tasks.size());

            var handedOff = 0;
            for (var task : tasks) {
                // only this method acquires, and the batch never exceeds the free permits
                slots.acquireUninterruptibly();
                try {
                    CompletableFuture.runAsync(() -> {
                        try {
                            execute(task);
                        } finally {
                            slots.release();
                        }
                    }, workerExecutor);
                    handedOff++;
                } catch (RejectedExecutionException e) {
                    slots.release();
                    log.error("Worker executor rejected run {}, leaving it to the stale-run sweeper", task.getRunId());
                }
            }
            return handedOff;
        } catch (Exception e) {
            log.error("Error in worker cycle: {}", e.getMessage(), e);
            return 0;
        }
    }

    /**
     * Execute one task and report its outcome
     */
    boolean execute(QueuedTask task) {
        var runId = task.getRunId();

        try {
            var claim = retryStateMachine.markRunning(runId, workerId);
            if (claim == RunClaim.NOT_VISIBLE) {
                redeliver(task);
                return false;
            }
            if (claim != RunClaim.CLAIMED) {
                return false;
            }

            log.info("Executing run {} of schedule {} (attempt {})", runId, task.getScheduleId(), task.getAttempt());

            var timerSample = metricsConfig.startTimer();
            var result = webhookInvoker.invoke(task.getPayload());
            metricsConfig.recordWebhookCall(timerSample, result.getStatus());

            retryStateMachine.reportOutcome(result.toReport(runId, workerId));
            return result.isSuccess();
        } catch (DispatchException e) {
            // the run is recovered by the stale-run sweeper
            log.warn("Follow-up of run {} could not be queued: {}", runId, e.getMessage());
            return false;
        } catch (Exception e) {
            log.error("Error executing run {}: {}", runId, e.getMessage(), e);
            return false;
        }
    }

    /**
     * Put back a task whose run row is not visible yet, typically because the enqueuing
     * transaction has not committed when the task is claimed.
     */
    private void redeliver(QueuedTask task) {
        var worker = properties.getWorker();
        if (task.getRedeliveries() >= worker.getMaxUnknownRunRedeliveries()) {
            log.warn("Run {} still not visible after {} redeliveries, leaving it to the stale-run sweeper",
                    task.getRunId(), task.getRedeliveries());
            return;
        }

        log.debug("Run {} not visible yet, redelivering (redelivery {})", task.getRunId(), task.getRedeliveries() + 1);
        taskQueue.enqueue(task.redelivered(), Duration.ofMillis(worker.getUnknownRunRedeliveryDelayMs()));
    }
}
