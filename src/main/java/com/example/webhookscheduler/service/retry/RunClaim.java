package com.example.webhookscheduler.service.retry;

/**
 * Result of a worker's attempt to claim a delivered run.
 */
public enum RunClaim {

    /**
     * The run was QUEUED and is now RUNNING for the caller
     */
    CLAIMED,

    /**
     * No run row is visible, usually because the transaction that created it has not committed yet
     */
    NOT_VISIBLE,

    /**
     * The run exists but is no longer QUEUED, so the delivery is a duplicate
     */
    NOT_QUEUED
}
