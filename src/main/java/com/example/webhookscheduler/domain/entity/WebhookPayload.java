package com.example.webhookscheduler.domain.entity;

import com.example.webhookscheduler.domain.enums.WebhookMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The HTTP request a run delivers.
 * <p>
 * Opaque to the scheduling core: it is copied from the schedule when an occurrence is queued,
 * stored with every attempt and handed unchanged to the task queue.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookPayload implements Serializable {

    private String targetUrl;

    private WebhookMethod httpMethod;

    @Builder.Default
    private Map<String, String> headers = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, String> queryParams = new LinkedHashMap<>();

    private String body;

    private String contentType;
}
