package com.example.webhookscheduler.domain.enums;

/**
 * HTTP methods a webhook may be invoked with
 */
public enum WebhookMethod {
    GET,
    POST,
    PUT,
    PATCH,
    DELETE
}
