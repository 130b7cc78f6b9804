package com.example.webhookscheduler.service.retry;

import com.example.webhookscheduler.domain.enums.RunStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Result of one webhook attempt as reported by a worker.
 * Status is SUCCESS, FAILED or TIMED_OUT.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutcomeReport {

    private UUID runId;

    private RunStatus status;

    private Long durationMs;

    private Integer responseStatus;

    private String responseSummary;

    private String errorMessage;

    private String workerId;
}
