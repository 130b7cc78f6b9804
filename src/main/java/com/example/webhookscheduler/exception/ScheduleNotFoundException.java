package com.example.webhookscheduler.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Exception for schedule not found
 */
@Getter
public class ScheduleNotFoundException extends RuntimeException {

    private final UUID scheduleId;

    public ScheduleNotFoundException(UUID scheduleId) {
        super("Schedule not found: " + scheduleId);
        this.scheduleId = scheduleId;
    }
}
