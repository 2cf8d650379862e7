package com.example.contentops.flowguard.quality;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Five checks on whether the guidance reads as the persona would say it. */
@Component
public class PersonaAuthenticityChecklist {

    public static final String RESPECTFUL_LANGUAGE = "respectful_language";
    public static final String CULTURAL_ACCURACY = "cultural_accuracy";
    public static final String APPROPRIATE_TONE = "appropriate_tone";
    public static final String FACTUAL_ACCURACY = "factual_accuracy";
    public static final String PERSONA_CONSISTENCY = "persona_consistency";

    private static final Map<String, String> IMPROVEMENTS = Map.of(
            RESPECTFUL_LANGUAGE, "Ensure all language is respectful and spiritual",
            CULTURAL_ACCURACY, "Add more authentic Tamil/Vedic references",
            APPROPRIATE_TONE, "Adjust tone to be more compassionate and guiding",
            FACTUAL_ACCURACY, "Correct basic astrological facts (12 signs, 27 nakshatras, 9 grahas)",
            PERSONA_CONSISTENCY, "Strengthen the persona's voice and mannerisms");

    private final QualityLexicon lexicon;

    public PersonaAuthenticityChecklist(QualityLexicon lexicon) {
        this.lexicon = lexicon;
    }

    public ChecklistResult evaluate(String generatedText) {
        String response = TextSignals.lower(generatedText);
        Map<String, Boolean> checks = new LinkedHashMap<>();
        checks.put(RESPECTFUL_LANGUAGE, !TextSignals.containsAny(response, lexicon.getDisrespectfulTerms()));
        checks.put(CULTURAL_ACCURACY,
                TextSignals.countTerms(response, lexicon.getTerminology()) >= lexicon.getMinTerminologyMatches());
        checks.put(APPROPRIATE_TONE, TextSignals.countTerms(response, lexicon.getPositiveTone())
                > TextSignals.countTerms(response, lexicon.getNegativeTone()));
        checks.put(FACTUAL_ACCURACY, !containsPhrase(response, lexicon.getFactualErrors()));
        checks.put(PERSONA_CONSISTENCY, TextSignals.containsAny(response, lexicon.getPersonaConsistencyMarkers()));

        List<String> improvements = new ArrayList<>();
        long passed = 0;
        for (Map.Entry<String, Boolean> check : checks.entrySet()) {
            if (check.getValue()) {
                passed++;
            } else {
                improvements.add(IMPROVEMENTS.get(check.getKey()));
            }
        }
        return new ChecklistResult(checks, (double) passed / checks.size(), improvements);
    }

    private static boolean containsPhrase(String text, List<String> phrases) {
        for (String phrase : phrases) {
            if (text.contains(phrase)) {
                return true;
            }
        }
        return false;
    }
}
