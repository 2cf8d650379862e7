package com.example.contentops.flowguard.model;

import com.example.contentops.flowguard.context.FlowReport;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Read model of a session: the live state of an active session or the final record persisted at
 * completion.
 */
@Builder
public record SessionReport(
        String sessionId,
        String ownerId,
        SessionStatus status,
        SessionPhase phase,
        Instant startedAt,
        Instant completedAt,
        double durationSeconds,
        List<StageResult> stageResults,
        List<Issue> issues,
        List<AutoFixRecord> autoFixes,
        List<String> anomalies,
        boolean dataLossDetected,
        double integrityScore,
        SessionMetrics metrics,
        QualityReport qualityReport,
        FlowReport flow,
        List<String> recommendations
) {

    public SessionReport {
        stageResults = stageResults == null ? List.of() : List.copyOf(stageResults);
        issues = issues == null ? List.of() : List.copyOf(issues);
        autoFixes = autoFixes == null ? List.of() : List.copyOf(autoFixes);
        anomalies = anomalies == null ? List.of() : List.copyOf(anomalies);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
