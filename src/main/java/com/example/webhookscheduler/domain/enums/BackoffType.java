package com.example.webhookscheduler.domain.enums;

import java.time.Duration;

/**
 * Retry delay progression between attempts of one occurrence.
 * The attempt argument is the 1-based number of the attempt that just failed.
 */
public enum BackoffType {

    FIXED {
        @Override
        public Duration delayFor(long backoffSeconds, int attempt) {
            return Duration.ofSeconds(backoffSeconds);
        }
    },

    LINEAR {
        @Override
        public Duration delayFor(long backoffSeconds, int attempt) {
            return Duration.ofSeconds(backoffSeconds * Math.max(attempt, 1));
        }
    },

    EXPONENTIAL {
        @Override
        public Duration delayFor(long backoffSeconds, int attempt) {
            // cap the shift so very long retry chains cannot overflow
            var exponent = Math.min(Math.max(attempt, 1) - 1, 30);
            return Duration.ofSeconds(backoffSeconds * (1L << exponent));
        }
    };

    public abstract Duration delayFor(long backoffSeconds, int attempt);
}
