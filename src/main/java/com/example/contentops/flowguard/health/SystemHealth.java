package com.example.contentops.flowguard.health;

import com.example.contentops.flowguard.model.StageResult;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * @param tier           derived from {@code stages}
 * @param activeSessions sessions currently tracked by the monitor
 * @param stages         per-stage rollup over the primary window
 * @param trend          per-stage rollup over the trend window
 * @param recentFailures newest failed results first
 */
public record SystemHealth(
        HealthTier tier,
        int activeSessions,
        Map<String, HealthRecord> stages,
        Map<String, HealthRecord> trend,
        List<StageResult> recentFailures,
        Instant generatedAt
) {
}
