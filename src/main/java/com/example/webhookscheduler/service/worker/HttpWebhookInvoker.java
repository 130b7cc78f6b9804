package com.example.webhookscheduler.service.worker;

import com.example.webhookscheduler.config.WebhookSchedulerProperties;
import com.example.webhookscheduler.domain.entity.WebhookPayload;
import com.example.webhookscheduler.domain.enums.WebhookMethod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Webhook calls through the shared WebClient.
 * <p>
 * Any HTTP status is a completed call: 2xx is SUCCESS, everything else FAILED. Exceeding the
 * request timeout is TIMED_OUT; connection errors and malformed requests are FAILED.
 */
@Slf4j
@Component
public class HttpWebhookInvoker implements WebhookInvoker {

    private final WebClient webClient;
    private final WebhookSchedulerProperties properties;

    public HttpWebhookInvoker(@Qualifier("webhookWebClient") WebClient webClient, WebhookSchedulerProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    @Override
    public WebhookInvocationResult invoke(WebhookPayload payload) {
        var timeout = Duration.ofSeconds(properties.getWorker().getRequestTimeoutSeconds());
        var start = System.nanoTime();

        try {
            var method = payload.getHttpMethod() != null ? payload.getHttpMethod() : WebhookMethod.POST;
            var request = webClient.method(HttpMethod.valueOf(method.name()))
                    .uri(buildUri(payload))
                    .headers(headers -> {
                        if (payload.getHeaders() != null) {
                            payload.getHeaders().forEach(headers::set);
                        }
                    });
            if (payload.getContentType() != null && !payload.getContentType().isBlank()) {
                request = request.contentType(MediaType.parseMediaType(payload.getContentType()));
            }

            WebClient.RequestHeadersSpec<?> exchange = payload.getBody() != null && method != WebhookMethod.GET
                    ? request.bodyValue(payload.getBody())
                    : request;

            var response = exchange.exchangeToMono(clientResponse -> clientResponse.toEntity(String.class))
                    .timeout(timeout)
                    .block();

            var durationMs = elapsedMs(start);
            if (response == null) {
                return WebhookInvocationResult.failure(new IllegalStateException("Empty response"), durationMs);
            }

            var status = response.getStatusCode().value();
            var summary = summarize(response.getBody());
            if (response.getStatusCode().is2xxSuccessful()) {
                log.debug("Webhook {} {} returned {} in {}ms", method, payload.getTargetUrl(), status, durationMs);
                return WebhookInvocationResult.success(status, summary, durationMs);
            }
            log.warn("Webhook {} {} returned {} in {}ms", method, payload.getTargetUrl(), status, durationMs);
            return WebhookInvocationResult.httpFailure(status, summary, durationMs);
        } catch (Exception e) {
            var durationMs = elapsedMs(start);
            if (isTimeout(e)) {
                log.warn("Webhook {} timed out after {}ms", payload.getTargetUrl(), durationMs);
                return WebhookInvocationResult.timedOut(String.format("Request timed out after %d seconds", timeout.toSeconds()), durationMs);
            }
            log.warn("Webhook {} failed: {}", payload.getTargetUrl(), e.getMessage());
            return WebhookInvocationResult.failure(rootCause(e), durationMs);
        }
    }

    private URI buildUri(WebhookPayload payload) {
        var builder = UriComponentsBuilder.fromUriString(payload.getTargetUrl());
        if (payload.getQueryParams() != null) {
            payload.getQueryParams().forEach(builder::queryParam);
        }
        return builder.encode().build().toUri();
    }

    String summarize(String body) {
        if (body == null) {
            return null;
        }
        var limit = properties.getWorker().getResponseSummaryLength();
        return body.length() > limit ? body.substring(0, limit) : body;
    }

    static boolean isTimeout(Throwable e) {
        for (var cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof TimeoutException || cause instanceof io.netty.handler.timeout.TimeoutException) {
                return true;
            }
            if (cause.getCause() == cause) {
                break;
            }
        }
        return false;
    }

    private static Throwable rootCause(Throwable e) {
        var cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static long elapsedMs(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }
}
