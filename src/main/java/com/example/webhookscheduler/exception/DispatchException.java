package com.example.webhookscheduler.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Exception raised when a run cannot be handed to the task queue.
 * The surrounding occurrence transaction must roll back.
 */
@Getter
public class DispatchException extends RuntimeException {

    private final UUID runId;

    public DispatchException(UUID runId, String message, Throwable cause) {
        super(String.format("Failed to dispatch run %s: %s", runId, message), cause);
        this.runId = runId;
    }
}
