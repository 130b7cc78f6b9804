package com.example.webhookscheduler.config;

import com.example.webhookscheduler.domain.enums.MissedOccurrencePolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the webhook scheduler.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "webhook-scheduler")
public class WebhookSchedulerProperties {

    /**
     * Whether this instance runs the due-schedule poller
     */
    private boolean pollerEnabled = true;

    /**
     * Seconds between poller ticks when adaptive polling is off
     */
    @Min(1)
    private long pollIntervalSeconds = 5;

    /**
     * Maximum number of due schedules fetched per tick
     */
    @Min(1)
    private int batchSize = 100;

    /**
     * Threads processing the candidates of one tick
     */
    @Min(1)
    private int executorPoolSize = 20;

    /**
     * Retry policy applied when a schedule does not set its own
     */
    @Min(1)
    private long defaultBackoffSeconds = 60;

    @Min(1)
    private int defaultMaxAttempts = 3;

    @NotNull
    private MissedOccurrencePolicy missedOccurrencePolicy = MissedOccurrencePolicy.SKIP_TO_LATEST;

    /**
     * Smallest accepted gap between two occurrences of a schedule
     */
    @Min(1)
    private long minimumIntervalSeconds = 5;

    /**
     * Sweeper cadence and the age after which a claimed run is considered lost
     */
    @Min(1000)
    private long staleRunCheckIntervalMs = 60000;

    @Min(1)
    private long runHardTimeoutSeconds = 300;

    @Valid
    private Lock lock = new Lock();

    @Valid
    private AdaptivePolling adaptivePolling = new AdaptivePolling();

    @Valid
    private Worker worker = new Worker();

    public enum LockBackend {
        AUTO,
        REDIS,
        DATABASE
    }

    @Data
    public static class Lock {

        /**
         * Lock expiry, bounds how long a crashed holder blocks a schedule
         */
        @Min(1)
        private long ttlSeconds = 30;

        @NotNull
        private LockBackend backend = LockBackend.AUTO;

        private String keyPrefix = "webhook-scheduler:lock:";
    }

    @Data
    public static class AdaptivePolling {

        private boolean enabled = false;

        @Min(1)
        private long minIntervalSeconds = 1;

        @Min(1)
        private long maxIntervalSeconds = 5;
    }

    @Data
    public static class Worker {

        private boolean enabled = true;

        @Min(100)
        private long pollIntervalMs = 1000;

        @Min(1)
        private int batchSize = 50;

        @Min(1)
        private int requestTimeoutSeconds = 30;

        @Min(1)
        private int poolSize = 20;

        /**
         * Delay before a delivery whose run is not visible yet is offered again
         */
        @Min(100)
        private long unknownRunRedeliveryDelayMs = 1000;

        /**
         * Redeliveries of a not-yet-visible run before it is left to the stale-run sweeper
         */
        @Min(0)
        private int maxUnknownRunRedeliveries = 5;

        /**
         * Maximum number of response body characters kept on the run
         */
        @Min(1)
        private int responseSummaryLength = 1000;
    }
}
