package com.example.webhookscheduler.service.dispatch;

import com.example.webhookscheduler.config.MetricsConfig;
import com.example.webhookscheduler.domain.entity.Run;
import com.example.webhookscheduler.domain.entity.WebhookPayload;
import com.example.webhookscheduler.domain.enums.RunStatus;
import com.example.webhookscheduler.exception.DispatchException;
import com.example.webhookscheduler.service.queue.QueuedTask;
import com.example.webhookscheduler.service.queue.TaskQueue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("ExecutionDispatcher Tests")
class ExecutionDispatcherTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Mock
    private TaskQueue taskQueue;

    @Mock
    private MetricsConfig metricsConfig;

    private ExecutionDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new ExecutionDispatcher(taskQueue, metricsConfig, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private Run run(int attempt, Instant scheduledFor) {
        return Run.builder()
                .id(UUID.randomUUID())
                .scheduleId(UUID.randomUUID())
                .tenantId("tenant-1")
                .runAt(NOW.minusSeconds(600))
                .attempt(attempt)
                .status(RunStatus.QUEUED)
                .scheduledFor(scheduledFor)
                .requestPayload(WebhookPayload.builder().targetUrl("https://example.com").build())
                .build();
    }

    @Test
    @DisplayName("Should enqueue an overdue run without delay")
    void shouldEnqueueImmediatelyWhenOverdue() {
        // Given
        var run = run(1, NOW.minusSeconds(5));
        var captor = ArgumentCaptor.forClass(QueuedTask.class);

        // When
        dispatcher.dispatch(run);

        // Then
        verify(taskQueue).enqueue(captor.capture(), eq(Duration.ZERO));
        assertThat(captor.getValue().getRunId()).isEqualTo(run.getId());
        assertThat(captor.getValue().getPayload().getTargetUrl()).isEqualTo("https://example.com");
    }

    @Test
    @DisplayName("Should delay a retry until its backoff has elapsed")
    void shouldDelayRetry() {
        // Given
        var run = run(2, NOW.plusSeconds(120));

        // When
        dispatcher.dispatch(run);

        // Then
        verify(taskQueue).enqueue(any(QueuedTask.class), eq(Duration.ofSeconds(120)));
    }

    @Test
    @DisplayName("Should count and rethrow a failed retry dispatch")
    void shouldRethrowDispatchFailure() {
        // Given
        var run = run(2, NOW);
        doThrow(new DispatchException(run.getId(), "task queue unreachable", null))
                .when(taskQueue).enqueue(any(QueuedTask.class), any(Duration.class));

        // When / Then
        assertThatThrownBy(() -> dispatcher.dispatch(run)).isInstanceOf(DispatchException.class);
        verify(metricsConfig).recordDispatchFailure("retry");
        verify(metricsConfig, never()).recordDispatchFailure("poller");
    }
}
