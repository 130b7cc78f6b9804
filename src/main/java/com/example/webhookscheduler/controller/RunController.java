package com.example.webhookscheduler.controller;

import com.example.webhookscheduler.dto.ApiResponse;
import com.example.webhookscheduler.dto.OutcomeReportRequest;
import com.example.webhookscheduler.dto.RunResponse;
import com.example.webhookscheduler.dto.RunStatistics;
import com.example.webhookscheduler.mapper.ScheduleMapper;
import com.example.webhookscheduler.service.RunLedgerService;
import com.example.webhookscheduler.service.retry.OutcomeReport;
import com.example.webhookscheduler.service.retry.RetryStateMachine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * REST API over the run ledger, plus the outcome callback for out-of-process workers.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/runs")
@Tag(name = "Runs", description = "Run ledger and outcome reporting")
public class RunController {

    private final RunLedgerService runLedgerService;
    private final RetryStateMachine retryStateMachine;
    private final ScheduleMapper scheduleMapper;

    @GetMapping("/{runId}")
    @Operation(summary = "Get run by ID")
    public ResponseEntity<ApiResponse<RunResponse>> getRun(@PathVariable UUID runId) {
        return runLedgerService.getRun(runId)
                .map(run -> ResponseEntity.ok(ApiResponse.success(run)))
                .orElse(ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.error("Run not found: " + runId)));
    }

    @PostMapping("/{runId}/outcome")
    @Operation(summary = "Report the outcome of an attempt",
            description = "Idempotent: a report for a run that already has an outcome returns its current state unchanged")
    public ResponseEntity<ApiResponse<RunResponse>> reportOutcome(@PathVariable UUID runId, @Valid @RequestBody OutcomeReportRequest request) {
        log.info("API: Outcome {} reported for run {}", request.getStatus(), runId);

        var run = retryStateMachine.reportOutcome(OutcomeReport.builder()
                .runId(runId)
                .status(request.getStatus())
                .durationMs(request.getDurationMs())
                .responseStatus(request.getResponseStatus())
                .responseSummary(request.getResponseSummary())
                .errorMessage(request.getErrorMessage())
                .workerId(request.getWorkerId())
                .build());
        return ResponseEntity.ok(ApiResponse.success(scheduleMapper.toRunResponse(run)));
    }

    @GetMapping("/dead-letter")
    @Operation(summary = "Dead-lettered attempts of a tenant")
    public ResponseEntity<ApiResponse<Page<RunResponse>>> getDeadLetters(
            @RequestParam String tenantId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {

        return ResponseEntity.ok(ApiResponse.success(runLedgerService.getDeadLetters(tenantId, PageRequest.of(page, Math.min(size, 100)))));
    }

    @GetMapping("/statistics")
    @Operation(summary = "Run and schedule counts")
    public ResponseEntity<ApiResponse<RunStatistics>> getStatistics() {
        return ResponseEntity.ok(ApiResponse.success(runLedgerService.getStatistics()));
    }
}
