package com.example.contentops.flowguard.model;

import com.example.contentops.flowguard.util.PayloadUtils;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable record of one stage validation inside a session. Expected/actual payloads are deep
 * copied on construction so later pipeline mutations cannot leak into the history.
 */
@Builder(toBuilder = true)
public record StageResult(
        String sessionId,
        int sequence,
        String stageId,
        boolean passed,
        Severity severity,
        String issueType,
        String description,
        Map<String, Object> expected,
        Map<String, Object> actual,
        long durationMs,
        long validationMs,
        boolean autoFixed,
        Instant recordedAt
) {

    public StageResult {
        severity = severity == null ? Severity.NONE : severity;
        expected = PayloadUtils.immutableCopy(expected);
        actual = PayloadUtils.immutableCopy(actual);
    }

    @JsonIgnore
    public boolean isCriticalFailure() {
        return !passed && severity == Severity.CRITICAL;
    }
}
