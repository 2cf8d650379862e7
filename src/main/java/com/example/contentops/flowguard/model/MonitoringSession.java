package com.example.contentops.flowguard.model;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one active pipeline run. Every mutation goes through a synchronized method so
 * the session's own monitor is the only lock involved.
 */
public class MonitoringSession {

    @Getter
    private final String id;
    @Getter
    private final String ownerId;
    @Getter
    private final Instant startedAt;
    private final int partialFailureThreshold;

    private final List<StageResult> stageResults = new ArrayList<>();
    private final List<Issue> issues = new ArrayList<>();
    private final List<AutoFixRecord> autoFixes = new ArrayList<>();
    private final List<String> anomalies = new ArrayList<>();

    private SessionStatus status = SessionStatus.SUCCESS;
    private SessionPhase phase = SessionPhase.STARTED;
    private boolean forcedFailure;
    private boolean businessValidated;
    private QualityReport qualityReport;
    private SessionMetrics metrics;
    private Instant completedAt;

    private int lastStageIndex = -1;
    private String lastStageId;

    public MonitoringSession(String id, String ownerId, Instant startedAt, int partialFailureThreshold) {
        this.id = id;
        this.ownerId = ownerId;
        this.startedAt = startedAt;
        this.partialFailureThreshold = partialFailureThreshold;
    }

    /** Appends the result with the next sequence number and re-derives status and phase. */
    public synchronized StageResult append(StageResult result) {
        StageResult sequenced = result.toBuilder()
                .sessionId(id)
                .sequence(stageResults.size() + 1)
                .build();
        stageResults.add(sequenced);
        status = forcedFailure
                ? SessionStatus.FAILED
                : SessionStatusPolicy.derive(stageResults, partialFailureThreshold);
        if (sequenced.isCriticalFailure()) {
            phase = SessionPhase.FAILED;
        } else if (phase != SessionPhase.FAILED) {
            phase = SessionPhase.STAGE_VALIDATED;
        }
        return sequenced;
    }

    public synchronized void addIssue(Issue issue) {
        issues.add(issue);
    }

    public synchronized void addAutoFix(AutoFixRecord fix) {
        autoFixes.add(fix);
    }

    /**
     * Tracks the canonical pipeline position of arriving stages.
     *
     * @param canonicalIndex position of the stage in the pipeline, negative for unknown stages
     * @return the anomaly message when the stage arrived after a later one, otherwise null
     */
    public synchronized String trackOrder(String stageId, int canonicalIndex) {
        if (canonicalIndex < 0) {
            return null;
        }
        String anomaly = null;
        if (canonicalIndex < lastStageIndex) {
            anomaly = "Stage '" + stageId + "' arrived after '" + lastStageId + "', out of pipeline order";
            anomalies.add(anomaly);
        }
        if (canonicalIndex >= lastStageIndex) {
            lastStageIndex = canonicalIndex;
            lastStageId = stageId;
        }
        return anomaly;
    }

    public synchronized void applyBusinessValidation(QualityReport report) {
        qualityReport = report;
        businessValidated = true;
        if (report.hasCriticalIssues()) {
            forcedFailure = true;
            status = SessionStatus.FAILED;
            phase = SessionPhase.FAILED;
        } else if (phase != SessionPhase.FAILED) {
            phase = SessionPhase.BUSINESS_VALIDATED;
        }
    }

    public synchronized void complete(Instant at, SessionMetrics finalMetrics) {
        completedAt = at;
        metrics = finalMetrics;
        if (phase != SessionPhase.FAILED) {
            phase = SessionPhase.COMPLETED;
        }
    }

    public synchronized List<StageResult> getStageResults() {
        return List.copyOf(stageResults);
    }

    public synchronized List<Issue> getIssues() {
        return List.copyOf(issues);
    }

    public synchronized List<AutoFixRecord> getAutoFixes() {
        return List.copyOf(autoFixes);
    }

    public synchronized List<String> getAnomalies() {
        return List.copyOf(anomalies);
    }

    public synchronized SessionStatus getStatus() {
        return status;
    }

    public synchronized SessionPhase getPhase() {
        return phase;
    }

    public synchronized boolean isBusinessValidated() {
        return businessValidated;
    }

    public synchronized boolean isForcedFailure() {
        return forcedFailure;
    }

    public synchronized QualityReport getQualityReport() {
        return qualityReport;
    }

    public synchronized SessionMetrics getMetrics() {
        return metrics;
    }

    public synchronized Instant getCompletedAt() {
        return completedAt;
    }

    public synchronized double durationSeconds(Instant now) {
        Instant end = completedAt != null ? completedAt : now;
        return Duration.between(startedAt, end).toMillis() / 1000.0;
    }
}
