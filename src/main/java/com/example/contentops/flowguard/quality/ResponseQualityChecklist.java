package com.example.contentops.flowguard.quality;

import com.example.contentops.flowguard.util.PayloadUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Six boolean checks over the generated guidance, averaged into a response-quality score. */
@Component
public class ResponseQualityChecklist {

    public static final String PERSONA_VOICE = "persona_voice";
    public static final String PROFILE_CONTEXT = "profile_context";
    public static final String KNOWLEDGE_REUSE = "knowledge_reuse";
    public static final String LENGTH_BOUNDS = "length_bounds";
    public static final String TONE_BALANCE = "tone_balance";
    public static final String TERMINOLOGY_DENSITY = "terminology_density";

    private static final Map<String, String> SUGGESTIONS = Map.of(
            PERSONA_VOICE, "Include phrases like 'my child', 'divine wisdom shows', 'let me guide you'",
            PROFILE_CONTEXT, "Reference specific planetary positions, houses, or nakshatra from the profile data",
            KNOWLEDGE_REUSE, "Integrate key phrases from the retrieved knowledge into the guidance",
            LENGTH_BOUNDS, "Keep the guidance within the word range expected for the service",
            TONE_BALANCE, "Use respectful, compassionate language befitting spiritual guidance",
            TERMINOLOGY_DENSITY, "Include Sanskrit terms, Tamil cultural references, or Vedic concepts");

    static final int KEY_PHRASES = 5;
    static final int MIN_REUSED_PHRASES = 2;

    private final QualityLexicon lexicon;

    public ResponseQualityChecklist(QualityLexicon lexicon) {
        this.lexicon = lexicon;
    }

    public ChecklistResult evaluate(String generatedText, String knowledgeText, Map<String, Object> profile,
                                    String serviceType) {
        String response = TextSignals.lower(generatedText);
        Map<String, Boolean> checks = new LinkedHashMap<>();
        checks.put(PERSONA_VOICE, TextSignals.containsAny(response, lexicon.getPersonaPatterns()));
        checks.put(PROFILE_CONTEXT, profile != null && !profile.isEmpty()
                && TextSignals.containsAny(response, lexicon.getProfileReferenceTerms()));
        checks.put(KNOWLEDGE_REUSE, reusesKnowledge(response, TextSignals.lower(knowledgeText)));
        QualityLexicon.LengthBounds bounds = lexicon.boundsFor(serviceType);
        int words = PayloadUtils.wordCount(generatedText);
        checks.put(LENGTH_BOUNDS, words >= bounds.getMinWords() && words <= bounds.getMaxWords());
        checks.put(TONE_BALANCE,
                TextSignals.countTerms(response, lexicon.getToneIndicators()) >= lexicon.getMinToneIndicators());
        checks.put(TERMINOLOGY_DENSITY,
                TextSignals.countTerms(response, lexicon.getTerminology()) >= lexicon.getMinTerminologyMatches());

        List<String> suggestions = new ArrayList<>();
        long passed = 0;
        for (Map.Entry<String, Boolean> check : checks.entrySet()) {
            if (check.getValue()) {
                passed++;
            } else {
                suggestions.add(SUGGESTIONS.get(check.getKey()));
            }
        }
        return new ChecklistResult(checks, (double) passed / checks.size(), suggestions);
    }

    private static boolean reusesKnowledge(String response, String knowledge) {
        if (knowledge.isBlank() || response.isBlank()) {
            return false;
        }
        int reused = 0;
        for (String phrase : TextSignals.keyPhrases(knowledge, KEY_PHRASES)) {
            if (response.contains(phrase)) {
                reused++;
            }
        }
        return reused >= MIN_REUSED_PHRASES;
    }
}
