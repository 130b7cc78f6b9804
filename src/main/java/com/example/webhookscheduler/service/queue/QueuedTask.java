package com.example.webhookscheduler.service.queue;

import com.example.webhookscheduler.domain.entity.Run;
import com.example.webhookscheduler.domain.entity.WebhookPayload;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Message placed on the task queue for one run.
 * Keyed by run id, so enqueuing the same run twice leaves a single entry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueuedTask {

    private UUID runId;

    private UUID scheduleId;

    private String tenantId;

    private int attempt;

    private WebhookPayload payload;

    /**
     * Times this task was put back because its run was not visible yet
     */
    private int redeliveries;

    public static QueuedTask from(Run run) {
        return QueuedTask.builder()
                .runId(run.getId())
                .scheduleId(run.getScheduleId())
                .tenantId(run.getTenantId())
                .attempt(run.getAttempt())
                .payload(run.getRequestPayload())
                .build();
    }

    public QueuedTask redelivered() {
        return new QueuedTask(runId, scheduleId, tenantId, attempt, payload, redeliveries + 1);
    }
}
