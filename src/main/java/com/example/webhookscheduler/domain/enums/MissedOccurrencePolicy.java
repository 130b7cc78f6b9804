package com.example.webhookscheduler.domain.enums;

/**
 * What the poller does when a schedule is more than one occurrence behind
 * (scheduler down, backlog larger than the batch size).
 */
public enum MissedOccurrencePolicy {

    /**
     * Enqueue the oldest missed occurrence once and move next_run_at past now
     */
    SKIP_TO_LATEST,

    /**
     * Advance by exactly one occurrence per enqueue so each missed occurrence fires
     */
    FIRE_EACH
}
