package com.example.webhookscheduler.service.retry;

import com.example.webhookscheduler.config.MetricsConfig;
import com.example.webhookscheduler.config.WebhookSchedulerProperties;
import com.example.webhookscheduler.domain.entity.Run;
import com.example.webhookscheduler.domain.entity.Schedule;
import com.example.webhookscheduler.domain.enums.BackoffType;
import com.example.webhookscheduler.domain.enums.RunStatus;
import com.example.webhookscheduler.domain.repository.RunRepository;
import com.example.webhookscheduler.domain.repository.ScheduleRepository;
import com.example.webhookscheduler.exception.RunNotFoundException;
import com.example.webhookscheduler.service.dispatch.ExecutionDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Applies worker outcomes to runs.
 * <p>
 * Handles:
 * - Worker claims (QUEUED -> RUNNING)
 * - Success as a terminal state
 * - Failures and timeouts: a new attempt after backoff, or dead-letter once max_attempts is spent
 * - Duplicate reports, which leave the run unchanged
 * <p>
 * The run row is locked for the duration of each transition, so two reports for the same run
 * are applied one after the other and the second sees the first's result.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetryStateMachine {

    static final String MAX_ATTEMPTS_MESSAGE = "Max attempts (%d) exceeded. Last error: %s";
    static final String SCHEDULE_MISSING_MESSAGE = "Schedule %s no longer exists. Last error: %s";

    private final RunRepository runRepository;
    private final ScheduleRepository scheduleRepository;
    private final ExecutionDispatcher executionDispatcher;
    private final WebhookSchedulerProperties properties;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    /**
     * Claim a queued run for execution.
     *
     * @return {@link RunClaim#CLAIMED} when the caller now owns the run
     */
    @Transactional
    public RunClaim markRunning(UUID runId, String workerId) {
        var run = runRepository.findByIdForUpdate(runId).orElse(null);
        if (run == null) {
            log.debug("Delivered run {} is not visible yet", runId);
            return RunClaim.NOT_VISIBLE;
        }
        if (run.getStatus() != RunStatus.QUEUED) {
            log.debug("Run {} is {} and cannot be claimed by {}, dropping duplicate delivery", runId, run.getStatus(), workerId);
            return RunClaim.NOT_QUEUED;
        }

        run.setStatus(RunStatus.RUNNING);
        run.setWorkerId(workerId);
        run.setStartedAt(clock.instant());
        runRepository.save(run);
        return RunClaim.CLAIMED;
    }

    /**
     * Record the outcome of an attempt and decide what follows.
     *
     * @return the reported run in its resulting state
     */
    @Transactional
    public Run reportOutcome(OutcomeReport report) {
        if (report.getStatus() == null || !report.getStatus().isReportable()) {
            throw new IllegalArgumentException("Outcome status must be SUCCESS, FAILED or TIMED_OUT, got " + report.getStatus());
        }

        var run = runRepository.findByIdForUpdate(report.getRunId())
                .orElseThrow(() -> new RunNotFoundException(report.getRunId()));

        if (!run.getStatus().isAwaitingOutcome()) {
            log.info("Ignoring {} report for run {}, already {}", report.getStatus(), run.getId(), run.getStatus());
            return run;
        }

        var now = clock.instant();
        applyReport(run, report, now);
        metricsConfig.recordOutcome(report.getStatus());

        if (report.getStatus() == RunStatus.SUCCESS) {
            run.setStatus(RunStatus.SUCCESS);
            log.info("Run {} of schedule {} succeeded on attempt {} in {}ms", run.getId(), run.getScheduleId(), run.getAttempt(), run.getDurationMs());
            return runRepository.save(run);
        }

        var lastError = describeFailure(report);
        var schedule = scheduleRepository.findById(run.getScheduleId()).orElse(null);
        if (schedule == null) {
            return deadLetter(run, String.format(SCHEDULE_MISSING_MESSAGE, run.getScheduleId(), lastError));
        }

        var maxAttempts = effectiveMaxAttempts(schedule);
        if (run.getAttempt() >= maxAttempts) {
            return deadLetter(run, String.format(MAX_ATTEMPTS_MESSAGE, maxAttempts, lastError));
        }

        run.setStatus(report.getStatus());
        runRepository.save(run);
        scheduleRetry(run, schedule, now);
        return run;
    }

    private void scheduleRetry(Run failed, Schedule schedule, Instant now) {
        var backoffType = schedule.getBackoffType() != null ? schedule.getBackoffType() : BackoffType.EXPONENTIAL;
        var backoffSeconds = schedule.getBackoffSeconds() != null ? schedule.getBackoffSeconds() : properties.getDefaultBackoffSeconds();
        var delay = backoffType.delayFor(backoffSeconds, failed.getAttempt());

        var retry = runRepository.save(failed.nextAttempt(now.plus(delay)));
        runRepository.flush();
        executionDispatcher.dispatch(retry);

        metricsConfig.recordRetry(retry.getAttempt());
        log.info("Run {} failed ({}), attempt {} of occurrence {} scheduled as run {} in {}s",
                failed.getId(), failed.getStatus(), retry.getAttempt(), failed.getRunAt(), retry.getId(), delay.toSeconds());
    }

    private Run deadLetter(Run run, String message) {
        log.error("Run {} of schedule {} dead-lettered: {}", run.getId(), run.getScheduleId(), message);

        run.setStatus(RunStatus.DEAD_LETTER);
        run.setErrorMessage(message);
        metricsConfig.recordDeadLetter();
        return runRepository.save(run);
    }

    private void applyReport(Run run, OutcomeReport report, Instant now) {
        run.setFinishedAt(now);
        run.setDurationMs(report.getDurationMs());
        run.setResponseStatus(report.getResponseStatus());
        run.setResponseSummary(report.getResponseSummary());
        run.setErrorMessage(report.getErrorMessage());
        if (report.getWorkerId() != null) {
            run.setWorkerId(report.getWorkerId());
        }
    }

    private int effectiveMaxAttempts(Schedule schedule) {
        return schedule.getMaxAttempts() != null ? schedule.getMaxAttempts() : properties.getDefaultMaxAttempts();
    }

    private static String describeFailure(OutcomeReport report) {
        if (report.getErrorMessage() != null && !report.getErrorMessage().isBlank()) {
            return report.getErrorMessage();
        }
        if (report.getResponseStatus() != null) {
            return "HTTP " + report.getResponseStatus();
        }
        return report.getStatus().getDisplayName();
    }
}
