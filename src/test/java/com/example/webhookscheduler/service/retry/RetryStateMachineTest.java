package com.example.webhookscheduler.service.retry;

import com.example.webhookscheduler.config.MetricsConfig;
import com.example.webhookscheduler.config.WebhookSchedulerProperties;
import com.example.webhookscheduler.domain.entity.Run;
import com.example.webhookscheduler.domain.entity.Schedule;
import com.example.webhookscheduler.domain.entity.WebhookPayload;
import com.example.webhookscheduler.domain.enums.BackoffType;
import com.example.webhookscheduler.domain.enums.RunStatus;
import com.example.webhookscheduler.domain.enums.ScheduleKind;
import com.example.webhookscheduler.domain.enums.ScheduleStatus;
import com.example.webhookscheduler.domain.repository.RunRepository;
import com.example.webhookscheduler.domain.repository.ScheduleRepository;
import com.example.webhookscheduler.exception.DispatchException;
import com.example.webhookscheduler.exception.RunNotFoundException;
import com.example.webhookscheduler.service.dispatch.ExecutionDispatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RetryStateMachine Tests")
class RetryStateMachineTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");
    private static final Instant OCCURRENCE = NOW.minusSeconds(30);

    @Mock
    private RunRepository runRepository;

    @Mock
    private ScheduleRepository scheduleRepository;

    @Mock
    private ExecutionDispatcher executionDispatcher;

    @Mock
    private MetricsConfig metricsConfig;

    private final Map<UUID, Run> runs = new LinkedHashMap<>();

    private RetryStateMachine stateMachine;
    private Schedule schedule;

    @BeforeEach
    void setUp() {
        stateMachine = new RetryStateMachine(runRepository, scheduleRepository, executionDispatcher,
                new WebhookSchedulerProperties(), metricsConfig, Clock.fixed(NOW, ZoneOffset.UTC));

        schedule = Schedule.builder()
                .id(UUID.randomUUID())
                .tenantId("tenant-1")
                .kind(ScheduleKind.INTERVAL)
                .intervalSeconds(300L)
                .status(ScheduleStatus.ACTIVE)
                .targetUrl("https://example.com/hook")
                .maxAttempts(3)
                .backoffSeconds(60L)
                .backoffType(BackoffType.EXPONENTIAL)
                .build();

        lenient().when(runRepository.findByIdForUpdate(any(UUID.class)))
                .thenAnswer(invocation -> Optional.ofNullable(runs.get(invocation.<UUID>getArgument(0))));
        lenient().when(runRepository.save(any(Run.class))).thenAnswer(invocation -> {
            Run run = invocation.getArgument(0);
            if (run.getId() == null) {
                run.setId(UUID.randomUUID());
            }
            runs.put(run.getId(), run);
            return run;
        });
        lenient().when(scheduleRepository.findById(schedule.getId())).thenReturn(Optional.of(schedule));
    }

    private Run firstAttempt(RunStatus status) {
        var run = Run.builder()
                .id(UUID.randomUUID())
                .scheduleId(schedule.getId())
                .tenantId("tenant-1")
                .runAt(OCCURRENCE)
                .attempt(1)
                .status(status)
                .scheduledFor(OCCURRENCE)
                .requestPayload(WebhookPayload.builder().targetUrl("https://example.com/hook").build())
                .build();
        runs.put(run.getId(), run);
        return run;
    }

    private OutcomeReport failure(UUID runId, String error) {
        return OutcomeReport.builder()
                .runId(runId)
                .status(RunStatus.FAILED)
                .responseStatus(500)
                .errorMessage(error)
                .durationMs(12L)
                .workerId("worker-1")
                .build();
    }

    private Run latestAttempt() {
        return runs.values().stream().max(Comparator.comparingInt(Run::getAttempt)).orElseThrow();
    }

    @Nested
    @DisplayName("markRunning Tests")
    class MarkRunningTests {

        @Test
        @DisplayName("Should claim a queued run")
        void shouldClaimQueuedRun() {
            // Given
            var run = firstAttempt(RunStatus.QUEUED);

            // When
            var claimed = stateMachine.markRunning(run.getId(), "worker-1");

            // Then
            assertThat(claimed).isEqualTo(RunClaim.CLAIMED);
            assertThat(run.getStatus()).isEqualTo(RunStatus.RUNNING);
            assertThat(run.getWorkerId()).isEqualTo("worker-1");
            assertThat(run.getStartedAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("Should refuse a second claim of the same run")
        void shouldRefuseDuplicateClaim() {
            var run = firstAttempt(RunStatus.QUEUED);

            assertThat(stateMachine.markRunning(run.getId(), "worker-1")).isEqualTo(RunClaim.CLAIMED);
            assertThat(stateMachine.markRunning(run.getId(), "worker-2")).isEqualTo(RunClaim.NOT_QUEUED);
            assertThat(run.getWorkerId()).isEqualTo("worker-1");
        }

        @Test
        @DisplayName("Should report a run that is not visible yet")
        void shouldReportInvisibleRun() {
            assertThat(stateMachine.markRunning(UUID.randomUUID(), "worker-1")).isEqualTo(RunClaim.NOT_VISIBLE);
        }
    }

    @Nested
    @DisplayName("Success Tests")
    class SuccessTests {

        @Test
        @DisplayName("Should record success as terminal without a retry")
        void shouldRecordSuccess() {
            // Given
            var run = firstAttempt(RunStatus.RUNNING);

            // When
            var result = stateMachine.reportOutcome(OutcomeReport.builder()
                    .runId(run.getId())
                    .status(RunStatus.SUCCESS)
                    .responseStatus(200)
                    .responseSummary("ok")
                    .durationMs(42L)
                    .build());

            // Then
            assertThat(result.getStatus()).isEqualTo(RunStatus.SUCCESS);
            assertThat(result.getFinishedAt()).isEqualTo(NOW);
            assertThat(result.getDurationMs()).isEqualTo(42L);
            assertThat(result.getResponseStatus()).isEqualTo(200);
            assertThat(runs).hasSize(1);
            verify(executionDispatcher, never()).dispatch(any());
        }

        @Test
        @DisplayName("Should ignore a duplicate success report")
        void shouldIgnoreDuplicateSuccess() {
            // Given
            var run = firstAttempt(RunStatus.RUNNING);
            var report = OutcomeReport.builder().runId(run.getId()).status(RunStatus.SUCCESS).durationMs(42L).build();
            stateMachine.reportOutcome(report);

            // When
            var second = stateMachine.reportOutcome(OutcomeReport.builder().runId(run.getId()).status(RunStatus.SUCCESS).durationMs(99L).build());

            // Then
            assertThat(second.getStatus()).isEqualTo(RunStatus.SUCCESS);
            assertThat(second.getDurationMs()).isEqualTo(42L);
            assertThat(runs).hasSize(1);
            verify(runRepository, times(1)).save(any(Run.class));
        }

        @Test
        @DisplayName("Should ignore a late failure after success")
        void shouldIgnoreFailureAfterSuccess() {
            var run = firstAttempt(RunStatus.RUNNING);
            stateMachine.reportOutcome(OutcomeReport.builder().runId(run.getId()).status(RunStatus.SUCCESS).build());

            var result = stateMachine.reportOutcome(failure(run.getId(), "late"));

            assertThat(result.getStatus()).isEqualTo(RunStatus.SUCCESS);
            assertThat(runs).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Failure Tests")
    class FailureTests {

        @Test
        @DisplayName("Should queue the next attempt of the same occurrence after backoff")
        void shouldQueueRetry() {
            // Given
            var run = firstAttempt(RunStatus.RUNNING);

            // When
            var result = stateMachine.reportOutcome(failure(run.getId(), "boom"));

            // Then
            assertThat(result.getStatus()).isEqualTo(RunStatus.FAILED);
            assertThat(result.getErrorMessage()).isEqualTo("boom");

            var retry = latestAttempt();
            assertThat(retry.getAttempt()).isEqualTo(2);
            assertThat(retry.getRunAt()).isEqualTo(OCCURRENCE);
            assertThat(retry.getStatus()).isEqualTo(RunStatus.QUEUED);
            assertThat(retry.getScheduledFor()).isEqualTo(NOW.plusSeconds(60));
            verify(executionDispatcher).dispatch(retry);
            verify(metricsConfig).recordRetry(2);
        }

        @Test
        @DisplayName("Should keep the timed out status on the failed attempt")
        void shouldRecordTimeout() {
            var run = firstAttempt(RunStatus.RUNNING);

            var result = stateMachine.reportOutcome(OutcomeReport.builder()
                    .runId(run.getId())
                    .status(RunStatus.TIMED_OUT)
                    .errorMessage("Request timed out after 30 seconds")
                    .build());

            assertThat(result.getStatus()).isEqualTo(RunStatus.TIMED_OUT);
            assertThat(latestAttempt().getAttempt()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should dead-letter the third attempt when three attempts are allowed")
        void shouldDeadLetterAfterMaxAttempts() {
            // Given
            var run = firstAttempt(RunStatus.RUNNING);

            // When - every attempt fails
            stateMachine.reportOutcome(failure(run.getId(), "boom"));
            stateMachine.reportOutcome(failure(latestAttempt().getId(), "boom"));
            var last = stateMachine.reportOutcome(failure(latestAttempt().getId(), "boom"));

            // Then
            assertThat(runs).hasSize(3);
            assertThat(runs.values()).extracting(Run::getAttempt).containsExactly(1, 2, 3);
            assertThat(runs.values()).extracting(Run::getRunAt).containsOnly(OCCURRENCE);
            assertThat(runs.values()).extracting(Run::getStatus)
                    .containsExactly(RunStatus.FAILED, RunStatus.FAILED, RunStatus.DEAD_LETTER);
            assertThat(last.getErrorMessage()).isEqualTo("Max attempts (3) exceeded. Last error: boom");
            verify(executionDispatcher, times(2)).dispatch(any(Run.class));
            verify(metricsConfig).recordDeadLetter();
        }

        @Test
        @DisplayName("Should grow the delay between attempts with exponential backoff")
        void shouldApplyExponentialBackoff() {
            // Given
            schedule.setMaxAttempts(4);
            var run = firstAttempt(RunStatus.RUNNING);

            // When
            stateMachine.reportOutcome(failure(run.getId(), "boom"));
            var second = latestAttempt();
            stateMachine.reportOutcome(failure(second.getId(), "boom"));
            var third = latestAttempt();
            stateMachine.reportOutcome(failure(third.getId(), "boom"));
            var fourth = latestAttempt();

            // Then
            assertThat(second.getScheduledFor()).isEqualTo(NOW.plusSeconds(60));
            assertThat(third.getScheduledFor()).isEqualTo(NOW.plusSeconds(120));
            assertThat(fourth.getScheduledFor()).isEqualTo(NOW.plusSeconds(240));
        }

        @Test
        @DisplayName("Should describe a failure without a message by its HTTP status")
        void shouldDescribeHttpFailure() {
            schedule.setMaxAttempts(1);
            var run = firstAttempt(RunStatus.RUNNING);

            var result = stateMachine.reportOutcome(OutcomeReport.builder()
                    .runId(run.getId())
                    .status(RunStatus.FAILED)
                    .responseStatus(502)
                    .build());

            assertThat(result.getStatus()).isEqualTo(RunStatus.DEAD_LETTER);
            assertThat(result.getErrorMessage()).isEqualTo("Max attempts (1) exceeded. Last error: HTTP 502");
        }

        @Test
        @DisplayName("Should dead-letter when the schedule is gone")
        void shouldDeadLetterWithoutSchedule() {
            // Given
            var run = firstAttempt(RunStatus.RUNNING);
            when(scheduleRepository.findById(schedule.getId())).thenReturn(Optional.empty());

            // When
            var result = stateMachine.reportOutcome(failure(run.getId(), "boom"));

            // Then
            assertThat(result.getStatus()).isEqualTo(RunStatus.DEAD_LETTER);
            assertThat(result.getErrorMessage()).startsWith("Schedule " + schedule.getId() + " no longer exists");
            assertThat(runs).hasSize(1);
        }

        @Test
        @DisplayName("Should propagate a failed retry dispatch")
        void shouldPropagateDispatchFailure() {
            // Given
            var run = firstAttempt(RunStatus.RUNNING);
            doThrow(new DispatchException(UUID.randomUUID(), "task queue unreachable", null))
                    .when(executionDispatcher).dispatch(any(Run.class));

            // When / Then
            assertThatThrownBy(() -> stateMachine.reportOutcome(failure(run.getId(), "boom")))
                    .isInstanceOf(DispatchException.class);
            verify(metricsConfig, never()).recordRetry(2);
        }
    }

    @Nested
    @DisplayName("Invalid Report Tests")
    class InvalidReportTests {

        @Test
        @DisplayName("Should reject statuses a worker cannot report")
        void shouldRejectNonReportableStatus() {
            var run = firstAttempt(RunStatus.RUNNING);

            assertThatThrownBy(() -> stateMachine.reportOutcome(OutcomeReport.builder().runId(run.getId()).status(RunStatus.QUEUED).build()))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> stateMachine.reportOutcome(OutcomeReport.builder().runId(run.getId()).status(RunStatus.DEAD_LETTER).build()))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should reject reports for unknown runs")
        void shouldRejectUnknownRun() {
            assertThatThrownBy(() -> stateMachine.reportOutcome(failure(UUID.randomUUID(), "boom")))
                    .isInstanceOf(RunNotFoundException.class);
        }
    }

    @Test
    @DisplayName("Should save the failed attempt before its retry")
    void shouldSaveFailedAttemptFirst() {
        var run = firstAttempt(RunStatus.RUNNING);

        stateMachine.reportOutcome(failure(run.getId(), "boom"));

        ArgumentCaptor<Run> captor = ArgumentCaptor.forClass(Run.class);
        verify(runRepository, times(2)).save(captor.capture());
        List<Run> saved = captor.getAllValues();
        assertThat(saved.get(0).getId()).isEqualTo(run.getId());
        assertThat(saved.get(1).getAttempt()).isEqualTo(2);
    }
}
