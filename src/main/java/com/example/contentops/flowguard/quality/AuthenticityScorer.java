package com.example.contentops.flowguard.quality;

import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Locale;

/**
 * Share of the domain terminology used in the answer. Profiles located in one of the configured
 * regions get the boost factor applied before capping.
 */
@Component
public class AuthenticityScorer implements RelevanceScorer {

    public static final String NAME = "authenticity";

    private final QualityLexicon lexicon;

    public AuthenticityScorer(QualityLexicon lexicon) {
        this.lexicon = lexicon;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<Double> score(ScoringInput input) {
        return Mono.fromSupplier(() -> {
            if (lexicon.getTerminology().isEmpty()) {
                return 0.0;
            }
            int found = TextSignals.countTerms(TextSignals.lower(input.generatedOrKnowledge()),
                    lexicon.getTerminology());
            double score = (double) found / lexicon.getTerminology().size();
            Object location = input.profile().get("location");
            if (location != null
                    && lexicon.getBoostRegions().contains(String.valueOf(location).trim().toLowerCase(Locale.ROOT))) {
                score *= lexicon.getBoostFactor();
            }
            return Math.min(score, 1.0);
        });
    }
}
