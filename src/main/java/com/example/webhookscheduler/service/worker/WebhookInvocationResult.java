package com.example.webhookscheduler.service.worker;

import com.example.webhookscheduler.domain.enums.RunStatus;
import com.example.webhookscheduler.service.retry.OutcomeReport;
import lombok.Builder;
import lombok.Data;

import java.util.UUID;

/**
 * Result of one webhook call, before it is reported to the retry state machine.
 */
@Data
@Builder
public class WebhookInvocationResult {

    /**
     * SUCCESS, FAILED or TIMED_OUT
     */
    private RunStatus status;

    private Integer responseStatus;

    /**
     * Leading part of the response body
     */
    private String responseSummary;

    private String errorMessage;

    /**
     * Error classification for logs, e.g. HTTP_503 or ConnectException
     */
    private String errorType;

    private long durationMs;

    public static WebhookInvocationResult success(int responseStatus, String responseSummary, long durationMs) {
        return WebhookInvocationResult.builder()
                .status(RunStatus.SUCCESS)
                .responseStatus(responseStatus)
                .responseSummary(responseSummary)
                .durationMs(durationMs)
                .build();
    }

    /**
     * Create a failure result for a non-2xx response
     */
    public static WebhookInvocationResult httpFailure(int responseStatus, String responseSummary, long durationMs) {
        return WebhookInvocationResult.builder()
                .status(RunStatus.FAILED)
                .responseStatus(responseStatus)
                .responseSummary(responseSummary)
                .errorMessage("Webhook responded with HTTP " + responseStatus)
                .errorType("HTTP_" + responseStatus)
                .durationMs(durationMs)
                .build();
    }

    public static WebhookInvocationResult timedOut(String errorMessage, long durationMs) {
        return WebhookInvocationResult.builder()
                .status(RunStatus.TIMED_OUT)
                .errorMessage(errorMessage)
                .errorType("TIMEOUT")
                .durationMs(durationMs)
                .build();
    }

    /**
     * Create a failure result for a call that produced no response
     */
    public static WebhookInvocationResult failure(Throwable e, long durationMs) {
        var message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return WebhookInvocationResult.builder()
                .status(RunStatus.FAILED)
                .errorMessage(message)
                .errorType(e.getClass().getSimpleName())
                .durationMs(durationMs)
                .build();
    }

    public boolean isSuccess() {
        return status == RunStatus.SUCCESS;
    }

    public OutcomeReport toReport(UUID runId, String workerId) {
        return OutcomeReport.builder()
                .runId(runId)
                .status(status)
                .durationMs(durationMs)
                .responseStatus(responseStatus)
                .responseSummary(responseSummary)
                .errorMessage(errorMessage)
                .workerId(workerId)
                .build();
    }
}
