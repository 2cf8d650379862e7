package com.example.contentops.flowguard.model;

/**
 * One business-validation finding.
 *
 * @param type        machine-friendly category, e.g. {@code low_relevance}
 * @param description human readable explanation
 * @param userImpact  estimated effect on the end user
 */
public record QualityFinding(String type, String description, String userImpact) {
}
