package com.example.contentops.flowguard.quality;

import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Compares the topical domain of the request with the domains detected in the retrieved knowledge.
 * Exact match scores 1.0; otherwise half credit scaled by how many related domains were detected.
 */
@Component
public class DomainMatchScorer implements RelevanceScorer {

    public static final String NAME = "domain_match";

    private final QualityLexicon lexicon;

    public DomainMatchScorer(QualityLexicon lexicon) {
        this.lexicon = lexicon;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<Double> score(ScoringInput input) {
        return Mono.fromSupplier(() -> {
            List<String> detected = detectDomains(input.knowledgeOrGenerated());
            if (detected.isEmpty()) {
                return 0.0;
            }
            String requested = classify(input.request());
            if (detected.contains(requested)) {
                return 1.0;
            }
            List<String> related = lexicon.getRelatedDomains().getOrDefault(requested, List.of());
            if (related.isEmpty()) {
                return 0.0;
            }
            long overlap = related.stream().filter(detected::contains).count();
            return 0.5 * overlap / related.size();
        });
    }

    /** Rule-based classification of a request; first matching domain in lexicon order wins. */
    public String classify(String request) {
        String lower = TextSignals.lower(request);
        for (Map.Entry<String, List<String>> domain : lexicon.getRequestDomains().entrySet()) {
            if (TextSignals.containsAny(lower, domain.getValue())) {
                return domain.getKey();
            }
        }
        return lexicon.getDefaultDomain();
    }

    List<String> detectDomains(String text) {
        String lower = TextSignals.lower(text);
        List<String> domains = new ArrayList<>();
        lexicon.getKnowledgeDomains().forEach((domain, words) -> {
            if (TextSignals.containsAny(lower, words)) {
                domains.add(domain);
            }
        });
        return domains;
    }
}
