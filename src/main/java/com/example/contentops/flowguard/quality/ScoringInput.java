package com.example.contentops.flowguard.quality;

import java.util.Map;

/**
 * Texts a relevance scorer compares.
 *
 * @param request        the originating user question
 * @param generatedText  final generated guidance, may be empty
 * @param knowledgeText  retrieved knowledge, may be empty
 * @param profile        structured profile data (birth details), may be empty
 * @param serviceType    service the request was made for
 */
public record ScoringInput(String request, String generatedText, String knowledgeText,
                           Map<String, Object> profile, String serviceType) {

    public ScoringInput {
        request = request == null ? "" : request;
        generatedText = generatedText == null ? "" : generatedText;
        knowledgeText = knowledgeText == null ? "" : knowledgeText;
        profile = profile == null ? Map.of() : profile;
    }

    String generatedOrKnowledge() {
        return generatedText.isBlank() ? knowledgeText : generatedText;
    }

    String knowledgeOrGenerated() {
        return knowledgeText.isBlank() ? generatedText : knowledgeText;
    }
}
