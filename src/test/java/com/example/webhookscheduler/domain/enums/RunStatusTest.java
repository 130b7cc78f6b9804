package com.example.webhookscheduler.domain.enums;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RunStatus Tests")
class RunStatusTest {

    @Nested
    @DisplayName("State Classification Tests")
    class StateClassificationTests {

        @ParameterizedTest
        @EnumSource(value = RunStatus.class, names = {"QUEUED", "RUNNING"})
        @DisplayName("Queued and running runs await an outcome")
        void shouldAwaitOutcome(RunStatus status) {
            assertThat(status.isAwaitingOutcome()).isTrue();
            assertThat(status.isTerminal()).isFalse();
        }

        @ParameterizedTest
        @EnumSource(value = RunStatus.class, names = {"SUCCESS", "DEAD_LETTER"})
        @DisplayName("Success and dead letter are terminal")
        void shouldBeTerminal(RunStatus status) {
            assertThat(status.isTerminal()).isTrue();
            assertThat(status.isAwaitingOutcome()).isFalse();
        }

        @Test
        @DisplayName("Only worker outcomes are reportable")
        void shouldLimitReportableStatuses() {
            assertThat(RunStatus.SUCCESS.isReportable()).isTrue();
            assertThat(RunStatus.FAILED.isReportable()).isTrue();
            assertThat(RunStatus.TIMED_OUT.isReportable()).isTrue();
            assertThat(RunStatus.QUEUED.isReportable()).isFalse();
            assertThat(RunStatus.DEAD_LETTER.isReportable()).isFalse();
        }
    }

    @Nested
    @DisplayName("fromCode Tests")
    class FromCodeTests {

        @Test
        @DisplayName("Should resolve by code and by name")
        void shouldResolve() {
            assertThat(RunStatus.fromCode("timed_out")).isEqualTo(RunStatus.TIMED_OUT);
            assertThat(RunStatus.fromCode("DEAD_LETTER")).isEqualTo(RunStatus.DEAD_LETTER);
        }

        @Test
        @DisplayName("Should reject unknown codes")
        void shouldRejectUnknown() {
            assertThatThrownBy(() -> RunStatus.fromCode("lost")).isInstanceOf(IllegalArgumentException.class);
        }
    }
}
