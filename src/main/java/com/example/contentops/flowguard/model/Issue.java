package com.example.contentops.flowguard.model;

import lombok.Builder;

import java.time.Instant;

/** A problem found in a session, either from a failed stage or from business validation. */
@Builder(toBuilder = true)
public record Issue(
        String stageId,
        String type,
        Severity severity,
        String description,
        String userImpact,
        boolean fixed,
        Instant detectedAt
) {
}
