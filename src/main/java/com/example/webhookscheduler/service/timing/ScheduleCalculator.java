package com.example.webhookscheduler.service.timing;

import com.example.webhookscheduler.config.WebhookSchedulerProperties;
import com.example.webhookscheduler.domain.entity.Schedule;
import com.example.webhookscheduler.domain.enums.MissedOccurrencePolicy;
import com.example.webhookscheduler.domain.enums.ScheduleKind;
import com.example.webhookscheduler.domain.trigger.CronTrigger;
import com.example.webhookscheduler.domain.trigger.IntervalTrigger;
import com.example.webhookscheduler.domain.trigger.OneOffTrigger;
import com.example.webhookscheduler.domain.trigger.ScheduleTrigger;
import com.example.webhookscheduler.domain.trigger.ScheduleTriggers;
import com.example.webhookscheduler.exception.ScheduleValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Next-fire-time computation and definition validation.
 * <p>
 * All methods are free of side effects; the clock is only read for the first occurrence of an
 * interval schedule and for the missed-occurrence policy.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScheduleCalculator {

    static final Duration MAX_INTERVAL = Duration.ofDays(366);

    /**
     * Number of consecutive cron fires sampled by the frequency floor check
     */
    private static final int CRON_FREQUENCY_SAMPLES = 16;

    private final Clock clock;
    private final WebhookSchedulerProperties properties;

    /**
     * Earliest fire instant strictly after {@code afterTime}, or null when the schedule has no further occurrence
     */
    public Instant computeNextRun(ScheduleTrigger trigger, Instant afterTime) {
        return trigger.nextRunAfter(afterTime, clock.instant());
    }

    /**
     * Next run of a schedule row, computed from its own next_run_at
     */
    public Instant computeNextRun(Schedule schedule) {
        return computeNextRun(schedule.toTrigger(), schedule.getNextRunAt());
    }

    /**
     * Parse and validate a definition.
     *
     * @return the trigger the definition describes
     * @throws ScheduleValidationException when the definition cannot be scheduled
     */
    public ScheduleTrigger validate(ScheduleKind kind, String expression, Long intervalSeconds, String timezone) {
        var trigger = ScheduleTriggers.of(kind, expression, intervalSeconds, timezone);
        validate(trigger);
        return trigger;
    }

    public void validate(ScheduleTrigger trigger) {
        var minimum = Duration.ofSeconds(properties.getMinimumIntervalSeconds());

        if (trigger instanceof IntervalTrigger interval) {
            if (interval.getInterval().compareTo(minimum) < 0) {
                throw new ScheduleValidationException("intervalSeconds",
                        String.format("Interval must be at least %d seconds", minimum.getSeconds()));
            }
            if (interval.getInterval().compareTo(MAX_INTERVAL) > 0) {
                throw new ScheduleValidationException("intervalSeconds",
                        String.format("Interval must not exceed %d days", MAX_INTERVAL.toDays()));
            }
        } else if (trigger instanceof OneOffTrigger oneOff) {
            if (!oneOff.getTarget().isAfter(clock.instant())) {
                throw new ScheduleValidationException("cronExpression",
                        String.format("One-off target %s is not in the future", oneOff.getTarget()));
            }
        } else if (trigger instanceof CronTrigger cron) {
            validateCronFrequency(cron, minimum);
        }
    }

    /**
     * Move a schedule that is behind to its next occurrence according to the policy.
     *
     * @param current the next_run_at being consumed
     * @return the new next_run_at, null when the trigger has no further occurrence
     */
    public Instant advance(ScheduleTrigger trigger, Instant current, MissedOccurrencePolicy policy) {
        var now = clock.instant();
        var next = trigger.nextRunAfter(current, now);
        if (next == null || policy == MissedOccurrencePolicy.FIRE_EACH || next.isAfter(now)) {
            return next;
        }
        return skipMissed(trigger, current, now);
    }

    /**
     * First occurrence strictly after now, keeping an interval schedule on its original phase
     */
    Instant skipMissed(ScheduleTrigger trigger, Instant current, Instant now) {
        if (trigger instanceof IntervalTrigger interval) {
            var step = interval.getInterval().toMillis();
            var behind = Duration.between(current, now).toMillis();
            var steps = behind / step + 1;
            var next = current.plusMillis(steps * step);
            log.debug("Skipping {} missed interval occurrences, next at {}", steps - 1, next);
            return next;
        }
        return trigger.nextRunAfter(now, now);
    }

    private void validateCronFrequency(CronTrigger cron, Duration minimum) {
        var previous = cron.nextRunAfter(clock.instant(), clock.instant());
        if (previous == null) {
            throw new ScheduleValidationException("cronExpression",
                    String.format("Cron expression '%s' never fires", cron.getExpression()));
        }
        for (var i = 0; i < CRON_FREQUENCY_SAMPLES; i++) {
            var next = cron.nextRunAfter(previous, previous);
            if (next == null) {
                return;
            }
            if (Duration.between(previous, next).compareTo(minimum) < 0) {
                throw new ScheduleValidationException("cronExpression",
                        String.format("Cron expression '%s' fires more often than every %d seconds",
                                cron.getExpression(), minimum.getSeconds()));
            }
            previous = next;
        }
    }
}
