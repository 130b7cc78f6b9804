package com.example.webhookscheduler.dto;

import com.example.webhookscheduler.domain.enums.RunStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for one run ledger entry
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunResponse {

    private UUID id;
    private UUID scheduleId;
    private String tenantId;
    private Instant runAt;
    private Integer attempt;
    private RunStatus status;
    private Instant scheduledFor;
    private String workerId;
    private Long durationMs;
    private Integer responseStatus;
    private String responseSummary;
    private String errorMessage;
    private Instant startedAt;
    private Instant finishedAt;
    private Instant createdAt;
}
