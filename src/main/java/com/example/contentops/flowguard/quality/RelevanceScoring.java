package com.example.contentops.flowguard.quality;

import com.example.contentops.flowguard.config.MonitorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Convex combination of the registered {@link RelevanceScorer}s. Weights are looked up by scorer
 * name and must sum to 1.
 */
@Slf4j
@Component
public class RelevanceScoring {

    private static final double WEIGHT_TOLERANCE = 1e-6;

    private final List<RelevanceScorer> scorers;
    private final Map<String, Double> weights;

    @Autowired
    public RelevanceScoring(List<RelevanceScorer> scorers, MonitorProperties props) {
        this(scorers, weightsOf(props.getRelevanceWeights()));
    }

    public RelevanceScoring(List<RelevanceScorer> scorers, Map<String, Double> weights) {
        this.scorers = List.copyOf(scorers);
        this.weights = new LinkedHashMap<>();
        double sum = 0.0;
        for (RelevanceScorer scorer : this.scorers) {
            Double weight = weights.get(scorer.name());
            if (weight == null || weight < 0) {
                throw new IllegalArgumentException("No valid weight configured for scorer " + scorer.name());
            }
            this.weights.put(scorer.name(), weight);
            sum += weight;
        }
        if (Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
            throw new IllegalArgumentException("Relevance weights must sum to 1 but sum to " + sum);
        }
    }

    static Map<String, Double> weightsOf(MonitorProperties.RelevanceWeights w) {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put(KeywordMatchScorer.NAME, w.getKeywordMatch());
        weights.put(DomainMatchScorer.NAME, w.getDomainMatch());
        weights.put(ContextRelevanceScorer.NAME, w.getContextRelevance());
        weights.put(SemanticSimilarityScorer.NAME, w.getSemanticSimilarity());
        weights.put(AuthenticityScorer.NAME, w.getAuthenticity());
        return weights;
    }

    public Mono<RelevanceBreakdown> score(ScoringInput input) {
        return Flux.fromIterable(scorers)
                .concatMap(scorer -> scorer.score(input)
                        .defaultIfEmpty(0.0)
                        .map(value -> Map.entry(scorer.name(), TextSignals.clamp(value))))
                .collectList()
                .map(entries -> {
                    Map<String, Double> scores = new LinkedHashMap<>();
                    double composite = 0.0;
                    for (Map.Entry<String, Double> entry : entries) {
                        scores.put(entry.getKey(), entry.getValue());
                        composite += weights.get(entry.getKey()) * entry.getValue();
                    }
                    double bounded = TextSignals.clamp(composite);
                    log.debug("[relevance] scores={} composite={}", scores, bounded);
                    return new RelevanceBreakdown(Map.copyOf(scores), bounded);
                });
    }

    public Map<String, Double> weights() {
        return Map.copyOf(weights);
    }
}
