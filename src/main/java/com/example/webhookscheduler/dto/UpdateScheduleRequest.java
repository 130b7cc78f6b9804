package com.example.webhookscheduler.dto;

import com.example.webhookscheduler.domain.enums.BackoffType;
import com.example.webhookscheduler.domain.enums.ScheduleKind;
import com.example.webhookscheduler.domain.enums.WebhookMethod;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request DTO for editing a schedule. Null fields are left unchanged.
 * <p>
 * Changing any trigger field recomputes next_run_at from now; queued runs are not affected.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateScheduleRequest {

    @Size(max = 200)
    private String name;

    @Size(max = 500)
    private String description;

    private ScheduleKind kind;

    private String cronExpression;

    private Long intervalSeconds;

    private String timezone;

    @Size(max = 2048)
    private String targetUrl;

    private WebhookMethod httpMethod;

    private Map<String, String> headers;

    private Map<String, String> queryParams;

    private String bodyTemplate;

    private String contentType;

    @Min(1)
    private Integer maxAttempts;

    @Min(1)
    private Long backoffSeconds;

    private BackoffType backoffType;

    public boolean changesTrigger() {
        return kind != null || cronExpression != null || intervalSeconds != null || timezone != null;
    }
}
