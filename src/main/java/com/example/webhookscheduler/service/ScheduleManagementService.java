package com.example.webhookscheduler.service;

import com.example.webhookscheduler.config.WebhookSchedulerProperties;
import com.example.webhookscheduler.domain.entity.Schedule;
import com.example.webhookscheduler.domain.enums.BackoffType;
import com.example.webhookscheduler.domain.enums.ScheduleStatus;
import com.example.webhookscheduler.domain.enums.WebhookMethod;
import com.example.webhookscheduler.domain.repository.ScheduleRepository;
import com.example.webhookscheduler.dto.CreateScheduleRequest;
import com.example.webhookscheduler.dto.ScheduleResponse;
import com.example.webhookscheduler.dto.UpdateScheduleRequest;
import com.example.webhookscheduler.exception.InvalidScheduleStateException;
import com.example.webhookscheduler.exception.ScheduleNotFoundException;
import com.example.webhookscheduler.exception.ScheduleValidationException;
import com.example.webhookscheduler.mapper.ScheduleMapper;
import com.example.webhookscheduler.service.timing.ScheduleCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.LinkedHashMap;
import java.util.Optional;
import java.util.UUID;

/**
 * Owner-facing schedule operations.
 * <p>
 * Handles:
 * - Creation with validation and the first next_run_at
 * - Edits; a trigger change recomputes next_run_at from now
 * - Pause, resume and soft delete
 * <p>
 * Runs already queued are never touched by these operations.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleManagementService {

    private final ScheduleRepository scheduleRepository;
    private final ScheduleCalculator scheduleCalculator;
    private final ScheduleMapper scheduleMapper;
    private final WebhookSchedulerProperties properties;

    // === Creation ===

    @Transactional
    public ScheduleResponse createSchedule(CreateScheduleRequest request) {
        var trigger = scheduleCalculator.validate(request.getKind(), request.getCronExpression(),
                request.getIntervalSeconds(), request.getTimezone());
        validateTargetUrl(request.getTargetUrl());

        var schedule = scheduleMapper.toEntity(request);
        applyDefaults(schedule);
        schedule.setStatus(ScheduleStatus.ACTIVE);
        schedule.setNextRunAt(scheduleCalculator.computeNextRun(trigger, null));

        var saved = scheduleRepository.save(schedule);
        log.info("Created {} schedule {} for tenant {}, first run at {}", saved.getKind(), saved.getId(), saved.getTenantId(), saved.getNextRunAt());

        return scheduleMapper.toResponse(saved);
    }

    // === Retrieval ===

    @Transactional(readOnly = true)
    public Optional<ScheduleResponse> getSchedule(UUID scheduleId) {
        return scheduleRepository.findById(scheduleId).map(scheduleMapper::toResponse);
    }

    /**
     * Schedules of a tenant; deleted ones only when that status is asked for explicitly
     */
    @Transactional(readOnly = true)
    public Page<ScheduleResponse> listSchedules(String tenantId, ScheduleStatus status, Pageable pageable) {
        var page = status != null
                ? scheduleRepository.findByTenantIdAndStatus(tenantId, status, pageable)
                : scheduleRepository.findByTenantIdAndStatusNot(tenantId, ScheduleStatus.DELETED, pageable);
        return page.map(scheduleMapper::toResponse);
    }

    // === Modification ===

    @Transactional
    public ScheduleResponse updateSchedule(UUID scheduleId, UpdateScheduleRequest request) {
        var schedule = load(scheduleId);
        if (schedule.getStatus().isTerminal()) {
            throw new InvalidScheduleStateException(scheduleId, schedule.getStatus().name(), "update");
        }

        scheduleMapper.applyUpdate(request, schedule);

        if (request.getTargetUrl() != null) {
            validateTargetUrl(schedule.getTargetUrl());
        }
        if (request.changesTrigger()) {
            var trigger = scheduleCalculator.validate(schedule.getKind(), schedule.getCronExpression(),
                    schedule.getIntervalSeconds(), schedule.getTimezone());
            if (schedule.getStatus() == ScheduleStatus.ACTIVE) {
                schedule.setNextRunAt(scheduleCalculator.computeNextRun(trigger, null));
            }
        }

        var saved = scheduleRepository.save(schedule);
        log.info("Updated schedule {}, next run at {}", scheduleId, saved.getNextRunAt());
        return scheduleMapper.toResponse(saved);
    }

    @Transactional
    public ScheduleResponse pauseSchedule(UUID scheduleId) {
        var schedule = load(scheduleId);
        if (schedule.getStatus() == ScheduleStatus.PAUSED) {
            return scheduleMapper.toResponse(schedule);
        }
        if (schedule.getStatus() != ScheduleStatus.ACTIVE) {
            throw new InvalidScheduleStateException(scheduleId, schedule.getStatus().name(), "pause");
        }

        schedule.setStatus(ScheduleStatus.PAUSED);
        log.info("Paused schedule {}", scheduleId);
        return scheduleMapper.toResponse(scheduleRepository.save(schedule));
    }

    /**
     * Reactivate a paused schedule. Occurrences missed while paused are not fired;
     * a one-off whose target passed while paused fires once on the next tick.
     */
    @Transactional
    public ScheduleResponse resumeSchedule(UUID scheduleId) {
        var schedule = load(scheduleId);
        if (schedule.getStatus() == ScheduleStatus.ACTIVE) {
            return scheduleMapper.toResponse(schedule);
        }
        if (schedule.getStatus() != ScheduleStatus.PAUSED) {
            throw new InvalidScheduleStateException(scheduleId, schedule.getStatus().name(), "resume");
        }

        schedule.setStatus(ScheduleStatus.ACTIVE);
        schedule.setNextRunAt(scheduleCalculator.computeNextRun(schedule.toTrigger(), null));
        log.info("Resumed schedule {}, next run at {}", scheduleId, schedule.getNextRunAt());
        return scheduleMapper.toResponse(scheduleRepository.save(schedule));
    }

    /**
     * Soft delete: the row and its run history stay, the poller never sees it again
     */
    @Transactional
    public void deleteSchedule(UUID scheduleId) {
        var schedule = load(scheduleId);
        if (schedule.getStatus() == ScheduleStatus.DELETED) {
            return;
        }

        schedule.setStatus(ScheduleStatus.DELETED);
        schedule.setNextRunAt(null);
        scheduleRepository.save(schedule);
        log.info("Deleted schedule {}", scheduleId);
    }

    // === Helpers ===

    private Schedule load(UUID scheduleId) {
        return scheduleRepository.findById(scheduleId).orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
    }

    private void applyDefaults(Schedule schedule) {
        if (schedule.getTimezone() == null || schedule.getTimezone().isBlank()) {
            schedule.setTimezone("UTC");
        }
        if (schedule.getHttpMethod() == null) {
            schedule.setHttpMethod(WebhookMethod.POST);
        }
        if (schedule.getHeaders() == null) {
            schedule.setHeaders(new LinkedHashMap<>());
        }
        if (schedule.getQueryParams() == null) {
            schedule.setQueryParams(new LinkedHashMap<>());
        }
        if (schedule.getMaxAttempts() == null) {
            schedule.setMaxAttempts(properties.getDefaultMaxAttempts());
        }
        if (schedule.getBackoffSeconds() == null) {
            schedule.setBackoffSeconds(properties.getDefaultBackoffSeconds());
        }
        if (schedule.getBackoffType() == null) {
            schedule.setBackoffType(BackoffType.EXPONENTIAL);
        }
    }

    private void validateTargetUrl(String targetUrl) {
        try {
            var uri = new URI(targetUrl);
            var scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https")) || uri.getHost() == null) {
                throw new ScheduleValidationException("targetUrl", "Target URL must be an absolute http or https URL");
            }
        } catch (URISyntaxException e) {
            throw new ScheduleValidationException("targetUrl", String.format("Invalid target URL '%s'", targetUrl));
        }
    }
}
