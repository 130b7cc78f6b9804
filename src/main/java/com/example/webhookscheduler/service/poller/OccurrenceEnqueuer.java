package com.example.webhookscheduler.service.poller;

import com.example.webhookscheduler.config.MetricsConfig;
import com.example.webhookscheduler.config.WebhookSchedulerProperties;
import com.example.webhookscheduler.domain.entity.Run;
import com.example.webhookscheduler.domain.enums.RunStatus;
import com.example.webhookscheduler.domain.enums.ScheduleStatus;
import com.example.webhookscheduler.domain.repository.RunRepository;
import com.example.webhookscheduler.domain.repository.ScheduleRepository;
import com.example.webhookscheduler.service.dispatch.ExecutionDispatcher;
import com.example.webhookscheduler.service.timing.ScheduleCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns one due occurrence of a locked schedule into a queued run.
 * <p>
 * Advancing next_run_at, inserting the run and enqueuing it happen in one transaction.
 * If the queue rejects the run the advancement is rolled back and the schedule stays due.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OccurrenceEnqueuer {

    private final ScheduleRepository scheduleRepository;
    private final RunRepository runRepository;
    private final ScheduleCalculator scheduleCalculator;
    private final ExecutionDispatcher executionDispatcher;
    private final WebhookSchedulerProperties properties;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    /**
     * Enqueue the occurrence at the schedule's current next_run_at.
     * The caller must hold the schedule's lock.
     *
     * @return the queued run, empty when the schedule is no longer due
     */
    @Transactional
    public Optional<Run> enqueueOccurrence(UUID scheduleId) {
        var now = clock.instant();

        // Re-read under the lock: another instance may have advanced it since the due query
        var schedule = scheduleRepository.findById(scheduleId).orElse(null);
        if (schedule == null) {
            log.warn("Schedule {} no longer exists", scheduleId);
            return Optional.empty();
        }
        if (!schedule.isDue(now)) {
            log.debug("Schedule {} is no longer due (status {}, next run {})", scheduleId, schedule.getStatus(), schedule.getNextRunAt());
            return Optional.empty();
        }

        var occurrence = schedule.getNextRunAt();
        var next = scheduleCalculator.advance(schedule.toTrigger(), occurrence, properties.getMissedOccurrencePolicy());

        schedule.setNextRunAt(next);
        schedule.setLastRunAt(now);
        if (next == null) {
            log.info("Schedule {} has no further occurrences, marking as completed", scheduleId);
            schedule.setStatus(ScheduleStatus.COMPLETED);
        }
        scheduleRepository.save(schedule);

        var run = runRepository.save(Run.builder()
                .scheduleId(schedule.getId())
                .tenantId(schedule.getTenantId())
                .runAt(occurrence)
                .attempt(1)
                .status(RunStatus.QUEUED)
                .scheduledFor(occurrence)
                .requestPayload(schedule.toWebhookPayload())
                .build());

        // Surface constraint violations before the run reaches the queue
        runRepository.flush();

        executionDispatcher.dispatch(run);
        metricsConfig.recordEnqueued(schedule.getKind().getCode());

        log.info("Enqueued occurrence {} of schedule {} as run {}, next run at {}", occurrence, scheduleId, run.getId(), next);
        return Optional.of(run);
    }
}
