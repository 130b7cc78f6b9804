package com.example.webhookscheduler.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Exception for run not found
 */
@Getter
public class RunNotFoundException extends RuntimeException {

    private final UUID runId;

    public RunNotFoundException(UUID runId) {
        super("Run not found: " + runId);
        this.runId = runId;
    }
}
