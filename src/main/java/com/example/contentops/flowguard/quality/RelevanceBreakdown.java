package com.example.contentops.flowguard.quality;

import java.util.Map;

/**
 * @param scores    sub-score per scorer name, each in [0,1]
 * @param composite weighted sum of the sub-scores, in [0,1]
 */
public record RelevanceBreakdown(Map<String, Double> scores, double composite) {

    public double score(String name) {
        return scores.getOrDefault(name, 0.0);
    }
}
