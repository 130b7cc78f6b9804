package com.example.webhookscheduler.config;

import com.example.webhookscheduler.domain.enums.RunStatus;
import com.example.webhookscheduler.domain.enums.ScheduleStatus;
import com.example.webhookscheduler.domain.repository.RunRepository;
import com.example.webhookscheduler.domain.repository.ScheduleRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for monitoring scheduler health.
 * <p>
 * Exposes Prometheus metrics for:
 * - Schedule counts by status and run counts by status
 * - Poller tick duration, enqueued occurrences and lock contention
 * - Dispatch failures, retries and dead letters
 * - Webhook call latency by outcome
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final ScheduleRepository scheduleRepository;
    private final RunRepository runRepository;

    private final ConcurrentHashMap<String, AtomicLong> gaugeValues = new ConcurrentHashMap<>();

    @PostConstruct
    public void initializeMetrics() {
        for (var status : ScheduleStatus.values()) {
            var key = "schedule_" + status.getCode();
            gaugeValues.put(key, new AtomicLong(0));

            Gauge.builder("webhook_scheduler_schedules", gaugeValues.get(key), AtomicLong::get)
                    .tag("status", status.getCode())
                    .description("Number of schedules by status")
                    .register(meterRegistry);
        }

        for (var status : RunStatus.values()) {
            var key = "run_" + status.getCode();
            gaugeValues.put(key, new AtomicLong(0));

            Gauge.builder("webhook_scheduler_runs", gaugeValues.get(key), AtomicLong::get)
                    .tag("status", status.getCode())
                    .description("Number of runs by status")
                    .register(meterRegistry);
        }
    }

    /**
     * Periodically refresh gauges from the database
     */
    @Scheduled(fixedDelayString = "${webhook-scheduler.metrics-update-interval-ms:60000}")
    public void updateMetrics() {
        try {
            for (var status : ScheduleStatus.values()) {
                gaugeValues.get("schedule_" + status.getCode()).set(scheduleRepository.countByStatus(status));
            }
            for (var status : RunStatus.values()) {
                gaugeValues.get("run_" + status.getCode()).set(runRepository.countByStatus(status));
            }
        } catch (DataAccessException e) {
            log.warn("Failed to refresh scheduler gauges: {}", e.getMessage());
        }
    }

    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * Record the duration of one poller tick
     */
    public void recordTick(Timer.Sample sample, int candidates) {
        sample.stop(Timer.builder("webhook_scheduler_poll_tick_time")
                .tag("empty", String.valueOf(candidates == 0))
                .description("Due-schedule poller tick duration")
                .register(meterRegistry));
    }

    /**
     * Record a webhook call and its outcome
     */
    public void recordWebhookCall(Timer.Sample sample, RunStatus outcome) {
        sample.stop(Timer.builder("webhook_scheduler_webhook_call_time")
                .tag("outcome", outcome.getCode())
                .description("Webhook call latency")
                .register(meterRegistry));
    }

    public void recordEnqueued(String kind) {
        meterRegistry.counter("webhook_scheduler_occurrences_enqueued", "kind", kind).increment();
    }

    public void recordLockContention(String backend) {
        meterRegistry.counter("webhook_scheduler_lock_contention", "backend", backend).increment();
    }

    public void recordLockError(String backend) {
        meterRegistry.counter("webhook_scheduler_lock_errors", "backend", backend).increment();
    }

    public void recordDispatchFailure(String source) {
        meterRegistry.counter("webhook_scheduler_dispatch_failures", "source", source).increment();
    }

    public void recordOutcome(RunStatus status) {
        meterRegistry.counter("webhook_scheduler_outcomes", "status", status.getCode()).increment();
    }

    public void recordRetry(int attemptNumber) {
        meterRegistry.counter("webhook_scheduler_retries", "attempt", String.valueOf(attemptNumber)).increment();
    }

    public void recordDeadLetter() {
        meterRegistry.counter("webhook_scheduler_dead_letters").increment();
    }

    public void recordStaleRun(RunStatus status) {
        meterRegistry.counter("webhook_scheduler_stale_runs", "status", status.getCode()).increment();
    }
}
