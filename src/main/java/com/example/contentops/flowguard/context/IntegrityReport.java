package com.example.contentops.flowguard.context;

import com.example.contentops.flowguard.model.DataLossEvent;

import java.util.List;

/**
 * Critical-field preservation for a session.
 *
 * @param score            preserved / total x 100 over critical fields present in the initial context
 * @param missingFields    critical fields that are no longer reachable or were marked lost
 * @param enrichmentCount  number of top-level keys added since the initial context
 * @param newFields        those keys, in insertion order
 * @param dataLossEvents   every loss recorded so far
 * @param dataLossDetected sticky flag, true once any loss was recorded
 */
public record IntegrityReport(
        double score,
        List<String> missingFields,
        int enrichmentCount,
        List<String> newFields,
        List<DataLossEvent> dataLossEvents,
        boolean dataLossDetected
) {
}
