package com.example.contentops.flowguard.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Final timing and pass-rate figures computed when a session completes.
 *
 * @param totalDurationMs  sum of all stage durations
 * @param stageDurations   summed duration per stage id (retries included), in arrival order
 * @param performanceScore latency bucket score: 100, 80, 60 or 40
 * @param qualityScore     percentage of stage results that passed
 */
public record SessionMetrics(
        long totalDurationMs,
        Map<String, Long> stageDurations,
        int performanceScore,
        double qualityScore
) {

    public SessionMetrics {
        stageDurations = stageDurations == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(stageDurations));
    }
}
