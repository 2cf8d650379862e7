package com.example.contentops.flowguard.context;

import java.time.Instant;
import java.util.List;

/** Top-level key diff between two consecutive snapshots. */
public record FlowStep(
        String stageId,
        List<String> addedKeys,
        List<String> removedKeys,
        List<String> modifiedKeys,
        long sizeBefore,
        long sizeAfter,
        Instant at
) {
}
