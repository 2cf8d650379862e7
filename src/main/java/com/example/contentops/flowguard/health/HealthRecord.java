package com.example.contentops.flowguard.health;

import java.time.Duration;

/**
 * Rollup of one stage over a trailing window. Always recomputed from stored stage results.
 *
 * @param successRate percentage of passed results, 100 when there are no samples
 */
public record HealthRecord(
        String stageId,
        Duration window,
        int totalCalls,
        int successfulCalls,
        double successRate,
        double averageLatencyMs,
        StageHealthStatus status
) {
}
