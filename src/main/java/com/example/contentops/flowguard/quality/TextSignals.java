package com.example.contentops.flowguard.quality;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Term matching over free text. A term matches when it starts a word, so "planet" matches
 * "planets" while "work" does not match "network".
 */
final class TextSignals {

    private static final Pattern TOKENIZER = Pattern.compile("[a-z0-9']+");
    private static final Map<String, Pattern> TERM_PATTERNS = new ConcurrentHashMap<>();

    private TextSignals() {
    }

    static String lower(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }

    static boolean containsTerm(String lowerText, String term) {
        if (lowerText.isEmpty() || term == null || term.isBlank()) {
            return false;
        }
        Pattern pattern = TERM_PATTERNS.computeIfAbsent(term.toLowerCase(Locale.ROOT),
                t -> Pattern.compile("(?<![a-z0-9])" + Pattern.quote(t)));
        return pattern.matcher(lowerText).find();
    }

    static Set<String> matchedTerms(String lowerText, Collection<String> terms) {
        Set<String> matched = new LinkedHashSet<>();
        for (String term : terms) {
            if (containsTerm(lowerText, term)) {
                matched.add(term);
            }
        }
        return matched;
    }

    static int countTerms(String lowerText, Collection<String> terms) {
        return matchedTerms(lowerText, terms).size();
    }

    static boolean containsAny(String lowerText, Collection<String> terms) {
        for (String term : terms) {
            if (containsTerm(lowerText, term)) {
                return true;
            }
        }
        return false;
    }

    static List<String> tokens(String lowerText) {
        List<String> tokens = new ArrayList<>();
        Matcher m = TOKENIZER.matcher(lowerText);
        while (m.find()) {
            tokens.add(m.group());
        }
        return tokens;
    }

    /** Leading distinct two-word phrases longer than five characters. */
    static List<String> keyPhrases(String lowerText, int limit) {
        List<String> tokens = tokens(lowerText);
        Set<String> phrases = new LinkedHashSet<>();
        for (int i = 0; i + 1 < tokens.size() && phrases.size() < limit; i++) {
            String phrase = tokens.get(i) + " " + tokens.get(i + 1);
            if (phrase.length() > 5) {
                phrases.add(phrase);
            }
        }
        return new ArrayList<>(phrases);
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
