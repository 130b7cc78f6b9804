package com.example.webhookscheduler.controller;

import com.example.webhookscheduler.domain.enums.ScheduleStatus;
import com.example.webhookscheduler.dto.ApiResponse;
import com.example.webhookscheduler.dto.CreateScheduleRequest;
import com.example.webhookscheduler.dto.RunResponse;
import com.example.webhookscheduler.dto.ScheduleResponse;
import com.example.webhookscheduler.dto.UpdateScheduleRequest;
import com.example.webhookscheduler.service.RunLedgerService;
import com.example.webhookscheduler.service.ScheduleManagementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * REST API for schedule owners.
 * <p>
 * Provides endpoints for:
 * - Creating, reading, editing and soft-deleting schedules
 * - Pausing and resuming
 * - Reading a schedule's run history
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/schedules")
@Tag(name = "Schedules", description = "APIs for managing webhook schedules")
public class ScheduleController {

    private final ScheduleManagementService scheduleManagementService;
    private final RunLedgerService runLedgerService;

    @PostMapping
    @Operation(summary = "Create a schedule", description = "Register a cron, interval or one-off webhook schedule")
    public ResponseEntity<ApiResponse<ScheduleResponse>> createSchedule(@Valid @RequestBody CreateScheduleRequest request) {
        log.info("API: Create {} schedule for tenant {}", request.getKind(), request.getTenantId());

        var response = scheduleManagementService.createSchedule(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response, "Schedule created successfully"));
    }

    @GetMapping("/{scheduleId}")
    @Operation(summary = "Get schedule by ID")
    public ResponseEntity<ApiResponse<ScheduleResponse>> getSchedule(@Parameter(description = "Schedule UUID") @PathVariable UUID scheduleId) {
        return scheduleManagementService.getSchedule(scheduleId)
                .map(schedule -> ResponseEntity.ok(ApiResponse.success(schedule)))
                .orElse(ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.error("Schedule not found: " + scheduleId)));
    }

    @GetMapping
    @Operation(summary = "List schedules of a tenant", description = "Deleted schedules are only returned when status=DELETED is requested")
    public ResponseEntity<ApiResponse<Page<ScheduleResponse>>> listSchedules(
            @RequestParam String tenantId,
            @RequestParam(required = false) ScheduleStatus status,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {

        var pageable = PageRequest.of(page, Math.min(size, 100), Sort.by(Sort.Direction.DESC, "createdAt"));
        return ResponseEntity.ok(ApiResponse.success(scheduleManagementService.listSchedules(tenantId, status, pageable)));
    }

    @PutMapping("/{scheduleId}")
    @Operation(summary = "Edit a schedule", description = "Changing the trigger recomputes the next run from now")
    public ResponseEntity<ApiResponse<ScheduleResponse>> updateSchedule(@PathVariable UUID scheduleId, @Valid @RequestBody UpdateScheduleRequest request) {
        log.info("API: Update schedule {}", scheduleId);

        return ResponseEntity.ok(ApiResponse.success(scheduleManagementService.updateSchedule(scheduleId, request), "Schedule updated"));
    }

    @PostMapping("/{scheduleId}/pause")
    @Operation(summary = "Pause a schedule")
    public ResponseEntity<ApiResponse<ScheduleResponse>> pauseSchedule(@PathVariable UUID scheduleId) {
        log.info("API: Pause schedule {}", scheduleId);

        return ResponseEntity.ok(ApiResponse.success(scheduleManagementService.pauseSchedule(scheduleId), "Schedule paused"));
    }

    @PostMapping("/{scheduleId}/resume")
    @Operation(summary = "Resume a paused schedule")
    public ResponseEntity<ApiResponse<ScheduleResponse>> resumeSchedule(@PathVariable UUID scheduleId) {
        log.info("API: Resume schedule {}", scheduleId);

        return ResponseEntity.ok(ApiResponse.success(scheduleManagementService.resumeSchedule(scheduleId), "Schedule resumed"));
    }

    @DeleteMapping("/{scheduleId}")
    @Operation(summary = "Delete a schedule", description = "Soft delete; run history is kept")
    public ResponseEntity<ApiResponse<Void>> deleteSchedule(@PathVariable UUID scheduleId) {
        log.info("API: Delete schedule {}", scheduleId);

        scheduleManagementService.deleteSchedule(scheduleId);
        return ResponseEntity.ok(ApiResponse.success(null, "Schedule deleted"));
    }

    @GetMapping("/{scheduleId}/runs")
    @Operation(summary = "Run history of a schedule", description = "Newest occurrence first, attempts in descending order")
    public ResponseEntity<ApiResponse<Page<RunResponse>>> getRuns(
            @PathVariable UUID scheduleId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {

        return ResponseEntity.ok(ApiResponse.success(runLedgerService.getRunsForSchedule(scheduleId, PageRequest.of(page, Math.min(size, 100)))));
    }
}
