package com.example.webhookscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Lifecycle status of a schedule.
 * Only ACTIVE schedules are picked up by the poller.
 */
@Getter
@RequiredArgsConstructor
public enum ScheduleStatus {

    /**
     * Eligible for polling once next_run_at has passed
     */
    ACTIVE("active", true),

    /**
     * Temporarily stopped by the owner; resumable
     */
    PAUSED("paused", false),

    /**
     * Soft-deleted. Retained for run history, never polled again.
     */
    DELETED("deleted", false),

    /**
     * A one-off schedule that has fired its single occurrence
     */
    COMPLETED("completed", false);

    private final String code;
    private final boolean pollable;

    public boolean isTerminal() {
        return this == DELETED || this == COMPLETED;
    }
}
