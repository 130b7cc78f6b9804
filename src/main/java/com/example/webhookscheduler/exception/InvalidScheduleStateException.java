package com.example.webhookscheduler.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Exception for an owner action that the schedule's current status does not allow
 */
@Getter
public class InvalidScheduleStateException extends RuntimeException {

    private final UUID scheduleId;
    private final String currentState;
    private final String requestedAction;

    public InvalidScheduleStateException(UUID scheduleId, String currentState, String requestedAction) {
        super(String.format("Cannot %s schedule %s in state %s", requestedAction, scheduleId, currentState));
        this.scheduleId = scheduleId;
        this.currentState = currentState;
        this.requestedAction = requestedAction;
    }
}
