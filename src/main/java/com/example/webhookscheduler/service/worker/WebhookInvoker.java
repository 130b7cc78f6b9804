package com.example.webhookscheduler.service.worker;

import com.example.webhookscheduler.domain.entity.WebhookPayload;

/**
 * Performs the HTTP call of a run. Never throws: every failure is returned as a result.
 */
public interface WebhookInvoker {

    WebhookInvocationResult invoke(WebhookPayload payload);
}
