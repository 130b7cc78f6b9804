package com.example.webhookscheduler.dto;

import com.example.webhookscheduler.domain.enums.BackoffType;
import com.example.webhookscheduler.domain.enums.ScheduleKind;
import com.example.webhookscheduler.domain.enums.ScheduleStatus;
import com.example.webhookscheduler.domain.enums.WebhookMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Response DTO for schedule data
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleResponse {

    private UUID id;
    private String tenantId;
    private String userId;
    private String name;
    private String description;
    private ScheduleKind kind;
    private String cronExpression;
    private Long intervalSeconds;
    private String timezone;
    private ScheduleStatus status;
    private Instant nextRunAt;
    private Instant lastRunAt;
    private String targetUrl;
    private WebhookMethod httpMethod;
    private Map<String, String> headers;
    private Map<String, String> queryParams;
    private String bodyTemplate;
    private String contentType;
    private Integer maxAttempts;
    private Long backoffSeconds;
    private BackoffType backoffType;
    private Instant createdAt;
    private Instant updatedAt;
}
