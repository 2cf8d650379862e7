package com.example.contentops.flowguard.quality;

import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/** Embedding cosine similarity between the request and the answer. */
@Component
public class SemanticSimilarityScorer implements RelevanceScorer {

    public static final String NAME = "semantic_similarity";

    private final EmbeddingSimilarityService similarityService;

    public SemanticSimilarityScorer(EmbeddingSimilarityService similarityService) {
        this.similarityService = similarityService;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<Double> score(ScoringInput input) {
        return similarityService.similarity(input.request(), input.generatedOrKnowledge());
    }
}
