package com.example.webhookscheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Webhook Scheduler Application
 * <p>
 * Fires tenant-registered HTTP webhooks on cron, interval and one-off schedules.
 * <p>
 * Features:
 * - Peer pollers coordinated by per-schedule Redis locks (database fallback)
 * - Cron evaluation in the schedule's own time zone, DST aware
 * - Delayed task queue on Redis
 * - Per-occurrence retries with fixed, linear or exponential backoff and a dead-letter state
 * - Append-only run ledger
 */
@EnableScheduling
@SpringBootApplication
public class WebhookSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(WebhookSchedulerApplication.class, args);
    }
}
