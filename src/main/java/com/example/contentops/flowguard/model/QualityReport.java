package com.example.contentops.flowguard.model;

import java.util.List;
import java.util.Map;

/**
 * Result of business validation over a whole session.
 *
 * @param overallValid    false when a critical finding exists or an error level check failed
 * @param criticalIssues  findings that force the session to FAILED
 * @param warnings        findings that only degrade the report
 * @param qualityScores   named scores; relevance sub-scores are in [0,1], percentages are 0..100
 * @param recommendations improvement suggestions, de-duplicated and in discovery order
 */
public record QualityReport(
        boolean overallValid,
        List<QualityFinding> criticalIssues,
        List<QualityFinding> warnings,
        Map<String, Double> qualityScores,
        List<String> recommendations
) {

    public QualityReport {
        criticalIssues = criticalIssues == null ? List.of() : List.copyOf(criticalIssues);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        qualityScores = qualityScores == null ? Map.of() : Map.copyOf(qualityScores);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    public boolean hasCriticalIssues() {
        return !criticalIssues.isEmpty();
    }
}
