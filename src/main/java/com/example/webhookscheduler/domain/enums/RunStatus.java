package com.example.webhookscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Status of a single execution attempt.
 * <p>
 * QUEUED -> RUNNING -> {SUCCESS | FAILED | TIMED_OUT}; a FAILED or TIMED_OUT attempt either
 * spawns the next attempt or is turned into DEAD_LETTER when the retry budget is spent.
 */
@Getter
@RequiredArgsConstructor
public enum RunStatus {

    QUEUED("queued", "Queued"),

    RUNNING("running", "Running"),

    SUCCESS("success", "Success"),

    FAILED("failed", "Failed"),

    TIMED_OUT("timed_out", "Timed Out"),

    DEAD_LETTER("dead_letter", "Dead Letter");

    private final String code;
    private final String displayName;

    public static RunStatus fromCode(String code) {
        for (var status : values()) {
            if (status.getCode().equalsIgnoreCase(code) || status.name().equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown run status code: " + code);
    }

    /**
     * An outcome report is only applied to runs in one of these states
     */
    public boolean isAwaitingOutcome() {
        return this == QUEUED || this == RUNNING;
    }

    public boolean isTerminal() {
        return this == SUCCESS || this == DEAD_LETTER;
    }

    /**
     * Outcomes a worker may report
     */
    public boolean isReportable() {
        return this == SUCCESS || this == FAILED || this == TIMED_OUT;
    }

    public boolean isFailure() {
        return this == FAILED || this == TIMED_OUT || this == DEAD_LETTER;
    }
}
