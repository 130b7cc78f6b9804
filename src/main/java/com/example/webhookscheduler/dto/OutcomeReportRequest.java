package com.example.webhookscheduler.dto;

import com.example.webhookscheduler.domain.enums.RunStatus;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome posted by an out-of-process worker
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutcomeReportRequest {

    /**
     * SUCCESS, FAILED or TIMED_OUT
     */
    @NotNull(message = "Status is required")
    private RunStatus status;

    @PositiveOrZero
    private Long durationMs;

    private Integer responseStatus;

    private String responseSummary;

    private String errorMessage;

    private String workerId;
}
