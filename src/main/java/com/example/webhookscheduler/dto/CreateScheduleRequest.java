package com.example.webhookscheduler.dto;

import com.example.webhookscheduler.domain.enums.BackoffType;
import com.example.webhookscheduler.domain.enums.ScheduleKind;
import com.example.webhookscheduler.domain.enums.WebhookMethod;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request DTO for creating a schedule
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateScheduleRequest {

    @NotBlank(message = "Tenant ID is required")
    private String tenantId;

    private String userId;

    @Size(max = 200)
    private String name;

    @Size(max = 500)
    private String description;

    @NotNull(message = "Schedule kind is required")
    private ScheduleKind kind;

    /**
     * Cron text for CRON, ISO-8601 instant for ONEOFF
     */
    private String cronExpression;

    /**
     * Seconds between occurrences for INTERVAL
     */
    private Long intervalSeconds;

    /**
     * IANA time zone (default: UTC)
     */
    private String timezone;

    @NotBlank(message = "Target URL is required")
    @Size(max = 2048)
    private String targetUrl;

    private WebhookMethod httpMethod;

    private Map<String, String> headers;

    private Map<String, String> queryParams;

    private String bodyTemplate;

    private String contentType;

    /**
     * Override default max attempts
     */
    @Min(1)
    private Integer maxAttempts;

    /**
     * Override default backoff base
     */
    @Min(1)
    private Long backoffSeconds;

    private BackoffType backoffType;
}
