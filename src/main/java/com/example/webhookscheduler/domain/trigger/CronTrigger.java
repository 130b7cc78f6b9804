package com.example.webhookscheduler.domain.trigger;

import com.example.webhookscheduler.domain.enums.ScheduleKind;
import lombok.Value;
import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Cron rule evaluated in a fixed time zone.
 * <p>
 * Local times skipped by a spring-forward transition are moved to the next valid time.
 * Local times repeated by a fall-back transition fire once, at the earlier offset.
 */
@Value
public class CronTrigger implements ScheduleTrigger {

    String expression;
    CronExpression cron;
    ZoneId zone;

    @Override
    public ScheduleKind getKind() {
        return ScheduleKind.CRON;
    }

    @Override
    public Instant nextRunAfter(Instant afterTime, Instant now) {
        var base = (afterTime != null ? afterTime : now).atZone(zone);
        var next = cron.next(base);
        // the second pass through a repeated local hour is not a new occurrence
        while (next != null && !next.toLocalDateTime().isAfter(base.toLocalDateTime())) {
            next = cron.next(next);
        }
        return next != null ? next.toInstant() : null;
    }
}
