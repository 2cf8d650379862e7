package com.example.contentops.flowguard.quality;

import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Jaccard overlap of lexicon keywords found in the request and in the answer. */
@Component
public class KeywordMatchScorer implements RelevanceScorer {

    public static final String NAME = "keyword_match";

    private final QualityLexicon lexicon;

    public KeywordMatchScorer(QualityLexicon lexicon) {
        this.lexicon = lexicon;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<Double> score(ScoringInput input) {
        return Mono.fromSupplier(() -> {
            Set<String> requestKeywords = keywords(input.request());
            Set<String> answerKeywords = keywords(input.generatedOrKnowledge());
            if (requestKeywords.isEmpty() || answerKeywords.isEmpty()) {
                return 0.0;
            }
            Set<String> union = new HashSet<>(requestKeywords);
            union.addAll(answerKeywords);
            Set<String> overlap = new HashSet<>(requestKeywords);
            overlap.retainAll(answerKeywords);
            return (double) overlap.size() / union.size();
        });
    }

    Set<String> keywords(String text) {
        String lower = TextSignals.lower(text);
        Set<String> found = new LinkedHashSet<>();
        for (List<String> words : lexicon.getKeywordCategories().values()) {
            found.addAll(TextSignals.matchedTerms(lower, words));
        }
        return found;
    }
}
