package com.example.webhookscheduler.domain.entity;

import com.example.webhookscheduler.domain.enums.BackoffType;
import com.example.webhookscheduler.domain.enums.ScheduleKind;
import com.example.webhookscheduler.domain.enums.ScheduleStatus;
import com.example.webhookscheduler.domain.enums.WebhookMethod;
import com.example.webhookscheduler.domain.trigger.ScheduleTrigger;
import com.example.webhookscheduler.domain.trigger.ScheduleTriggers;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A tenant-owned webhook job.
 * <p>
 * Holds:
 * - The trigger definition (cron, interval or one-off) and its time zone
 * - Runtime state driven by the poller (next_run_at, last_run_at)
 * - The opaque webhook request
 * - The retry policy applied to every occurrence
 * - Fallback lock columns used when Redis is not the lock backend
 */
@Entity
@Table(name = "schedules", indexes = {
        @Index(name = "idx_schedule_status_next_run", columnList = "status, next_run_at"),
        @Index(name = "idx_schedule_tenant", columnList = "tenant_id"),
        @Index(name = "idx_schedule_locked_by_until", columnList = "locked_by, locked_until")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Schedule {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, length = 100)
    private String tenantId;

    @Column(name = "user_id", length = 100)
    private String userId;

    @Column(name = "name", length = 200)
    private String name;

    @Column(name = "description", length = 500)
    private String description;

    // === Trigger Definition ===

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 20)
    private ScheduleKind kind;

    /**
     * Cron text for CRON schedules, ISO-8601 instant for ONEOFF schedules
     */
    @Column(name = "cron_expression", length = 100)
    private String cronExpression;

    @Column(name = "interval_seconds")
    private Long intervalSeconds;

    /**
     * IANA zone the cron expression is evaluated in
     */
    @Column(name = "timezone", nullable = false, length = 64)
    @Builder.Default
    private String timezone = "UTC";

    // === Runtime State ===

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ScheduleStatus status;

    @Column(name = "next_run_at")
    private Instant nextRunAt;

    @Column(name = "last_run_at")
    private Instant lastRunAt;

    // === Webhook Request ===

    @Column(name = "target_url", nullable = false, length = 2048)
    private String targetUrl;

    @Enumerated(EnumType.STRING)
    @Column(name = "http_method", nullable = false, length = 10)
    @Builder.Default
    private WebhookMethod httpMethod = WebhookMethod.POST;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "headers", columnDefinition = "jsonb")
    @Builder.Default
    private Map<String, String> headers = new LinkedHashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "query_params", columnDefinition = "jsonb")
    @Builder.Default
    private Map<String, String> queryParams = new LinkedHashMap<>();

    @Column(name = "body_template", columnDefinition = "TEXT")
    private String bodyTemplate;

    @Column(name = "content_type", length = 100)
    private String contentType;

    // === Retry Policy ===

    @Column(name = "max_attempts", nullable = false)
    private Integer maxAttempts;

    @Column(name = "backoff_seconds", nullable = false)
    private Long backoffSeconds;

    @Enumerated(EnumType.STRING)
    @Column(name = "backoff_type", nullable = false, length = 20)
    @Builder.Default
    private BackoffType backoffType = BackoffType.EXPONENTIAL;

    // === Fallback Locking Fields ===
    // Written only by the lock queries in ScheduleRepository, never by entity updates

    @Column(name = "locked_by", length = 100, insertable = false, updatable = false)
    private String lockedBy;

    @Column(name = "locked_until", insertable = false, updatable = false)
    private Instant lockedUntil;

    @Version
    @Column(name = "version")
    private Long version;

    // === Audit Fields ===

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
        if (this.status == null) {
            this.status = ScheduleStatus.ACTIVE;
        }
        if (this.timezone == null) {
            this.timezone = "UTC";
        }
        if (this.headers == null) {
            this.headers = new LinkedHashMap<>();
        }
        if (this.queryParams == null) {
            this.queryParams = new LinkedHashMap<>();
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // === Helper Methods ===

    /**
     * Build the trigger value for this row's kind
     */
    public ScheduleTrigger toTrigger() {
        return ScheduleTriggers.of(kind, cronExpression, intervalSeconds, timezone);
    }

    /**
     * Check whether the poller should enqueue an occurrence at the given instant
     */
    public boolean isDue(Instant now) {
        return status == ScheduleStatus.ACTIVE && nextRunAt != null && !nextRunAt.isAfter(now);
    }

    /**
     * Snapshot of the webhook request for a new occurrence
     */
    public WebhookPayload toWebhookPayload() {
        return WebhookPayload.builder()
                .targetUrl(targetUrl)
                .httpMethod(httpMethod)
                .headers(headers != null ? new LinkedHashMap<>(headers) : new LinkedHashMap<>())
                .queryParams(queryParams != null ? new LinkedHashMap<>(queryParams) : new LinkedHashMap<>())
                .body(bodyTemplate)
                .contentType(contentType)
                .build();
    }
}
