package com.example.webhookscheduler.domain.trigger;

import com.example.webhookscheduler.domain.enums.ScheduleKind;
import lombok.Value;

import java.time.Instant;

/**
 * A single absolute fire instant.
 */
@Value
public class OneOffTrigger implements ScheduleTrigger {

    Instant target;

    @Override
    public ScheduleKind getKind() {
        return ScheduleKind.ONEOFF;
    }

    @Override
    public Instant nextRunAfter(Instant afterTime, Instant now) {
        if (afterTime == null || afterTime.isBefore(target)) {
            return target;
        }
        return null;
    }
}
