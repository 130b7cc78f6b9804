package com.example.webhookscheduler.domain.trigger;

import com.example.webhookscheduler.exception.ScheduleValidationException;

/**
 * Converts user-facing cron text to the seconds-first form Spring's parser reads.
 * <p>
 * Accepted forms:
 * - 5 fields: minute hour day-of-month month day-of-week (seconds default to 0)
 * - 6 fields: the same five followed by seconds
 * - Macros: @yearly, @annually, @monthly, @weekly, @daily, @midnight, @hourly
 */
public final class CronExpressions {

    private CronExpressions() {
    }

    public static String normalize(String expression) {
        var trimmed = expression.trim();
        if (trimmed.startsWith("@")) {
            return trimmed.toLowerCase();
        }

        var fields = trimmed.split("\\s+");
        if (fields.length == 5) {
            return "0 " + String.join(" ", fields);
        }
        if (fields.length == 6) {
            var reordered = new StringBuilder(fields[5]);
            for (var i = 0; i < 5; i++) {
                reordered.append(' ').append(fields[i]);
            }
            return reordered.toString();
        }

        throw new ScheduleValidationException("cronExpression",
                String.format("Cron expression '%s' must have 5 or 6 fields, found %d", expression, fields.length));
    }
}
