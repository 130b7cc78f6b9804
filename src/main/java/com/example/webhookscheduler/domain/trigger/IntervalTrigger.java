package com.example.webhookscheduler.domain.trigger;

import com.example.webhookscheduler.domain.enums.ScheduleKind;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Fixed period between occurrences, anchored on the previous occurrence.
 */
@Value
public class IntervalTrigger implements ScheduleTrigger {

    Duration interval;

    @Override
    public ScheduleKind getKind() {
        return ScheduleKind.INTERVAL;
    }

    @Override
    public Instant nextRunAfter(Instant afterTime, Instant now) {
        return (afterTime != null ? afterTime : now).plus(interval);
    }
}
