package com.example.webhookscheduler.service.worker;

import com.example.webhookscheduler.config.WebhookSchedulerProperties;
import com.example.webhookscheduler.domain.entity.WebhookPayload;
import com.example.webhookscheduler.domain.enums.RunStatus;
import com.example.webhookscheduler.domain.enums.WebhookMethod;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HttpWebhookInvoker Tests")
class HttpWebhookInvokerTest {

    private WebhookSchedulerProperties properties;
    private AtomicReference<ClientRequest> lastRequest;

    @BeforeEach
    void setUp() {
        properties = new WebhookSchedulerProperties();
        properties.getWorker().setRequestTimeoutSeconds(1);
        lastRequest = new AtomicReference<>();
    }

    private HttpWebhookInvoker invoker(ExchangeFunction exchange) {
        ExchangeFunction recording = request -> {
            lastRequest.set(request);
            return exchange.exchange(request);
        };
        return new HttpWebhookInvoker(WebClient.builder().exchangeFunction(recording).build(), properties);
    }

    private static ExchangeFunction respond(HttpStatus status, String body) {
        return request -> Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, "text/plain")
                .body(body)
                .build());
    }

    private static WebhookPayload payload(WebhookMethod method) {
        return WebhookPayload.builder()
                .targetUrl("https://hooks.example.com/notify")
                .httpMethod(method)
                .headers(Map.of("X-Signature", "abc123"))
                .queryParams(Map.of("source", "scheduler"))
                .body("{\"event\":\"tick\"}")
                .contentType("application/json")
                .build();
    }

    @Nested
    @DisplayName("Response Tests")
    class ResponseTests {

        @Test
        @DisplayName("Should report a 2xx response as success")
        void shouldReportSuccess() {
            // Given
            var invoker = invoker(respond(HttpStatus.OK, "accepted"));

            // When
            var result = invoker.invoke(payload(WebhookMethod.POST));

            // Then
            assertThat(result.getStatus()).isEqualTo(RunStatus.SUCCESS);
            assertThat(result.getResponseStatus()).isEqualTo(200);
            assertThat(result.getResponseSummary()).isEqualTo("accepted");
            assertThat(result.getDurationMs()).isNotNegative();
        }

        @Test
        @DisplayName("Should report a 5xx response as a failed call")
        void shouldReportServerError() {
            // Given
            var invoker = invoker(respond(HttpStatus.SERVICE_UNAVAILABLE, "down for maintenance"));

            // When
            var result = invoker.invoke(payload(WebhookMethod.POST));

            // Then
            assertThat(result.getStatus()).isEqualTo(RunStatus.FAILED);
            assertThat(result.getResponseStatus()).isEqualTo(503);
            assertThat(result.getErrorType()).isEqualTo("HTTP_503");
        }

        @Test
        @DisplayName("Should truncate long response bodies")
        void shouldTruncateSummary() {
            // Given
            properties.getWorker().setResponseSummaryLength(10);
            var invoker = invoker(respond(HttpStatus.OK, "0123456789abcdef"));

            // When
            var result = invoker.invoke(payload(WebhookMethod.POST));

            // Then
            assertThat(result.getResponseSummary()).isEqualTo("0123456789");
        }
    }

    @Nested
    @DisplayName("Request Tests")
    class RequestTests {

        @Test
        @DisplayName("Should send the configured method, headers and query parameters")
        void shouldBuildRequest() {
            // Given
            var invoker = invoker(respond(HttpStatus.OK, "ok"));

            // When
            invoker.invoke(payload(WebhookMethod.PUT));

            // Then
            var request = lastRequest.get();
            assertThat(request.method()).isEqualTo(HttpMethod.PUT);
            assertThat(request.url().toString()).isEqualTo("https://hooks.example.com/notify?source=scheduler");
            assertThat(request.headers().getFirst("X-Signature")).isEqualTo("abc123");
            assertThat(request.headers().getFirst(HttpHeaders.CONTENT_TYPE)).isEqualTo("application/json");
        }

        @Test
        @DisplayName("Should default to POST")
        void shouldDefaultToPost() {
            var invoker = invoker(respond(HttpStatus.OK, "ok"));

            invoker.invoke(payload(null));

            assertThat(lastRequest.get().method()).isEqualTo(HttpMethod.POST);
        }
    }

    @Nested
    @DisplayName("Error Tests")
    class ErrorTests {

        @Test
        @DisplayName("Should report a request exceeding the timeout as timed out")
        void shouldReportTimeout() {
            // Given
            var invoker = invoker(request -> Mono.never());

            // When
            var result = invoker.invoke(payload(WebhookMethod.POST));

            // Then
            assertThat(result.getStatus()).isEqualTo(RunStatus.TIMED_OUT);
            assertThat(result.getErrorMessage()).isEqualTo("Request timed out after 1 seconds");
            assertThat(result.getResponseStatus()).isNull();
        }

        @Test
        @DisplayName("Should report a refused connection as a failed call")
        void shouldReportConnectionError() {
            // Given
            var invoker = invoker(request -> Mono.error(new ConnectException("Connection refused")));

            // When
            var result = invoker.invoke(payload(WebhookMethod.POST));

            // Then
            assertThat(result.getStatus()).isEqualTo(RunStatus.FAILED);
            assertThat(result.getErrorMessage()).contains("Connection refused");
            assertThat(result.getResponseStatus()).isNull();
        }
    }

    @Test
    @DisplayName("Should recognise timeouts wrapped by Reactor")
    void shouldDetectWrappedTimeouts() {
        assertThat(HttpWebhookInvoker.isTimeout(new RuntimeException(new TimeoutException("late")))).isTrue();
        assertThat(HttpWebhookInvoker.isTimeout(new RuntimeException(new ConnectException("refused")))).isFalse();
    }
}
