package com.example.webhookscheduler.domain.trigger;

import com.example.webhookscheduler.domain.enums.ScheduleKind;
import com.example.webhookscheduler.exception.ScheduleValidationException;
import org.springframework.scheduling.support.CronExpression;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;

/**
 * Builds {@link ScheduleTrigger} values from the columns of a schedule row.
 * Malformed definitions are reported as {@link ScheduleValidationException}.
 */
public final class ScheduleTriggers {

    private ScheduleTriggers() {
    }

    public static ScheduleTrigger of(ScheduleKind kind, String expression, Long intervalSeconds, String timezone) {
        if (kind == null) {
            throw new ScheduleValidationException("kind", "Schedule kind is required");
        }
        return switch (kind) {
            case CRON -> cron(expression, timezone);
            case INTERVAL -> interval(intervalSeconds);
            case ONEOFF -> oneOff(expression);
        };
    }

    public static CronTrigger cron(String expression, String timezone) {
        if (expression == null || expression.isBlank()) {
            throw new ScheduleValidationException("cronExpression", "Cron expression is required for cron schedules");
        }
        var zone = zone(timezone);
        var normalized = CronExpressions.normalize(expression);
        try {
            return new CronTrigger(expression.trim(), CronExpression.parse(normalized), zone);
        } catch (IllegalArgumentException e) {
            throw new ScheduleValidationException("cronExpression",
                    String.format("Invalid cron expression '%s': %s", expression, e.getMessage()));
        }
    }

    public static IntervalTrigger interval(Long intervalSeconds) {
        if (intervalSeconds == null || intervalSeconds <= 0) {
            throw new ScheduleValidationException("intervalSeconds", "Interval seconds must be a positive number");
        }
        return new IntervalTrigger(Duration.ofSeconds(intervalSeconds));
    }

    public static OneOffTrigger oneOff(String instant) {
        if (instant == null || instant.isBlank()) {
            throw new ScheduleValidationException("cronExpression", "Target instant is required for one-off schedules");
        }
        return new OneOffTrigger(parseInstant(instant.trim()));
    }

    public static ZoneId zone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.of("UTC");
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw new ScheduleValidationException("timezone", String.format("Unknown time zone '%s'", timezone));
        }
    }

    private static Instant parseInstant(String value) {
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(value).toInstant();
            } catch (DateTimeParseException ex) {
                throw new ScheduleValidationException("cronExpression",
                        String.format("Invalid ISO-8601 instant '%s'", value));
            }
        }
    }
}
