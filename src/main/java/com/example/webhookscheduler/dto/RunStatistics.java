package com.example.webhookscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Statistics response
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunStatistics {

    private Map<String, Long> runStatusDistribution;
    private Map<String, Long> scheduleStatusDistribution;
    private long queuedCount;
    private long runningCount;
    private long deadLetterCount;
    private long taskQueueDepth;
    private Instant generatedAt;
}
