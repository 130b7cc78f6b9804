package com.example.webhookscheduler.domain.trigger;

import com.example.webhookscheduler.domain.enums.ScheduleKind;

import java.time.Instant;

/**
 * Fire-time rule of a schedule, one implementation per {@link ScheduleKind}.
 */
public interface ScheduleTrigger {

    ScheduleKind getKind();

    /**
     * Earliest fire instant strictly after {@code afterTime}, or null when the trigger never fires again.
     *
     * @param afterTime previous occurrence, null when computing the first one
     * @param now       current instant, used only when there is no previous occurrence
     */
    Instant nextRunAfter(Instant afterTime, Instant now);
}
