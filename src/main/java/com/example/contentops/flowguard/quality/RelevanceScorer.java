package com.example.contentops.flowguard.quality;

import reactor.core.publisher.Mono;

/** One relevance sub-score. Values outside [0,1] are clamped by {@link RelevanceScoring}. */
public interface RelevanceScorer {

    /** Score name, also the key of its configured weight. */
    String name();

    Mono<Double> score(ScoringInput input);
}
