package com.example.webhookscheduler.domain.entity;

import com.example.webhookscheduler.domain.enums.RunStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * One execution attempt of one occurrence of a schedule.
 * <p>
 * Rows are never deleted. A retry is a new row with the same run_at and attempt + 1,
 * so the attempts of an occurrence read as a gap-free sequence.
 */
@Entity
@Table(name = "runs",
        uniqueConstraints = @UniqueConstraint(name = "uk_run_occurrence_attempt", columnNames = {"schedule_id", "run_at", "attempt"}),
        indexes = {
                @Index(name = "idx_run_schedule_run_at", columnList = "schedule_id, run_at"),
                @Index(name = "idx_run_status", columnList = "status"),
                @Index(name = "idx_run_tenant_status", columnList = "tenant_id, status")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Run {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "schedule_id", nullable = false)
    private UUID scheduleId;

    @Column(name = "tenant_id", nullable = false, length = 100)
    private String tenantId;

    /**
     * The occurrence instant this attempt belongs to, not the dispatch time
     */
    @Column(name = "run_at", nullable = false)
    private Instant runAt;

    @Column(name = "attempt", nullable = false)
    private Integer attempt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private RunStatus status;

    /**
     * When the attempt becomes deliverable: run_at for the first attempt, now + backoff for retries
     */
    @Column(name = "scheduled_for", nullable = false)
    private Instant scheduledFor;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "request_payload", columnDefinition = "jsonb")
    private WebhookPayload requestPayload;

    // === Outcome ===

    @Column(name = "worker_id", length = 100)
    private String workerId;

    @Column(name = "duration_ms")
    private Long durationMs;

    @Column(name = "response_status")
    private Integer responseStatus;

    @Column(name = "response_summary", columnDefinition = "TEXT")
    private String responseSummary;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        this.createdAt = Instant.now();
        if (this.status == null) {
            this.status = RunStatus.QUEUED;
        }
        if (this.attempt == null) {
            this.attempt = 1;
        }
        if (this.scheduledFor == null) {
            this.scheduledFor = this.runAt;
        }
    }

    /**
     * Build the next attempt of the same occurrence
     */
    public Run nextAttempt(Instant scheduledFor) {
        return Run.builder()
                .scheduleId(scheduleId)
                .tenantId(tenantId)
                .runAt(runAt)
                .attempt(attempt + 1)
                .status(RunStatus.QUEUED)
                .scheduledFor(scheduledFor)
                .requestPayload(requestPayload)
                .build();
    }
}
