package com.example.webhookscheduler.service;

import com.example.webhookscheduler.domain.enums.RunStatus;
import com.example.webhookscheduler.domain.enums.ScheduleStatus;
import com.example.webhookscheduler.domain.repository.RunRepository;
import com.example.webhookscheduler.domain.repository.ScheduleRepository;
import com.example.webhookscheduler.dto.RunResponse;
import com.example.webhookscheduler.dto.RunStatistics;
import com.example.webhookscheduler.exception.ScheduleNotFoundException;
import com.example.webhookscheduler.mapper.ScheduleMapper;
import com.example.webhookscheduler.service.queue.TaskQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read side of the run ledger.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class RunLedgerService {

    private final RunRepository runRepository;
    private final ScheduleRepository scheduleRepository;
    private final ScheduleMapper scheduleMapper;
    private final TaskQueue taskQueue;
    private final Clock clock;

    public Optional<RunResponse> getRun(UUID runId) {
        return runRepository.findById(runId).map(scheduleMapper::toRunResponse);
    }

    /**
     * Attempts of a schedule, newest occurrence first
     */
    public Page<RunResponse> getRunsForSchedule(UUID scheduleId, Pageable pageable) {
        if (!scheduleRepository.existsById(scheduleId)) {
            throw new ScheduleNotFoundException(scheduleId);
        }
        return runRepository.findByScheduleIdOrderByRunAtDescAttemptDesc(scheduleId, pageable).map(scheduleMapper::toRunResponse);
    }

    public List<RunResponse> getOccurrenceAttempts(UUID scheduleId, Instant runAt) {
        return scheduleMapper.toRunResponses(runRepository.findByScheduleIdAndRunAtOrderByAttemptAsc(scheduleId, runAt));
    }

    public Page<RunResponse> getDeadLetters(String tenantId, Pageable pageable) {
        return runRepository.findByTenantIdAndStatusOrderByFinishedAtDesc(tenantId, RunStatus.DEAD_LETTER, pageable)
                .map(scheduleMapper::toRunResponse);
    }

    public RunStatistics getStatistics() {
        var runDistribution = new HashMap<String, Long>();
        for (var row : runRepository.getRunStatsByStatus()) {
            runDistribution.put(((RunStatus) row[0]).name(), (Long) row[1]);
        }

        var scheduleDistribution = new HashMap<String, Long>();
        for (var status : ScheduleStatus.values()) {
            scheduleDistribution.put(status.name(), scheduleRepository.countByStatus(status));
        }

        return RunStatistics.builder()
                .runStatusDistribution(runDistribution)
                .scheduleStatusDistribution(scheduleDistribution)
                .queuedCount(runDistribution.getOrDefault(RunStatus.QUEUED.name(), 0L))
                .runningCount(runDistribution.getOrDefault(RunStatus.RUNNING.name(), 0L))
                .deadLetterCount(runDistribution.getOrDefault(RunStatus.DEAD_LETTER.name(), 0L))
                .taskQueueDepth(queueDepth())
                .generatedAt(clock.instant())
                .build();
    }

    private long queueDepth() {
        try {
            return taskQueue.size();
        } catch (DataAccessException e) {
            log.warn("Could not read task queue depth: {}", e.getMessage());
            return -1;
        }
    }
}
