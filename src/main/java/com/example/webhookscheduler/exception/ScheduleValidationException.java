package com.example.webhookscheduler.exception;

import lombok.Getter;

/**
 * Exception for a schedule definition that cannot be accepted
 */
@Getter
public class ScheduleValidationException extends RuntimeException {

    private final String field;

    public ScheduleValidationException(String field, String message) {
        super(message);
        this.field = field;
    }
}
