package com.example.contentops.flowguard.quality;

import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/** Density of structured-data reference terms reused in the answer, capped at 1. */
@Component
public class ContextRelevanceScorer implements RelevanceScorer {

    public static final String NAME = "context_relevance";

    private final QualityLexicon lexicon;

    public ContextRelevanceScorer(QualityLexicon lexicon) {
        this.lexicon = lexicon;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<Double> score(ScoringInput input) {
        return Mono.fromSupplier(() -> {
            int found = TextSignals.countTerms(TextSignals.lower(input.generatedOrKnowledge()),
                    lexicon.getReferenceTerms());
            int cap = Math.max(1, lexicon.getReferenceCap());
            return Math.min((double) found / cap, 1.0);
        });
    }
}
