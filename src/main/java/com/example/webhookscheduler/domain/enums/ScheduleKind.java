package com.example.webhookscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * How a schedule computes its fire times.
 */
@Getter
@RequiredArgsConstructor
public enum ScheduleKind {

    /**
     * Cron expression evaluated in the schedule's time zone
     */
    CRON("cron", "Cron"),

    /**
     * Fixed number of seconds between occurrences
     */
    INTERVAL("interval", "Interval"),

    /**
     * Single absolute instant
     */
    ONEOFF("oneoff", "One-off");

    private final String code;
    private final String displayName;

    public static ScheduleKind fromCode(String code) {
        for (var kind : values()) {
            if (kind.getCode().equalsIgnoreCase(code) || kind.name().equalsIgnoreCase(code)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown schedule kind: " + code);
    }
}
