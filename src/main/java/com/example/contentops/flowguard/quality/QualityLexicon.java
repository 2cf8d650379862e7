package com.example.contentops.flowguard.quality;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Heuristic vocabularies for business validation, bound from {@code quality-lexicon.json}.
 * Domain maps keep file order; the first request domain whose keywords match wins.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class QualityLexicon {

    public static final String DEFAULT_LOCATION = "quality-lexicon.json";
    public static final String DEFAULT_SERVICE = "default";

    private LinkedHashMap<String, List<String>> keywordCategories = new LinkedHashMap<>();
    private LinkedHashMap<String, List<String>> requestDomains = new LinkedHashMap<>();
    private String defaultDomain = "general";
    private LinkedHashMap<String, List<String>> knowledgeDomains = new LinkedHashMap<>();
    private Map<String, List<String>> relatedDomains = new LinkedHashMap<>();

    private List<String> referenceTerms = new ArrayList<>();
    /** Number of reference terms that earns a full context-relevance score. */
    private int referenceCap = 5;
    private List<String> profileReferenceTerms = new ArrayList<>();

    private List<String> terminology = new ArrayList<>();
    private List<String> boostRegions = new ArrayList<>();
    private double boostFactor = 1.2;

    private List<String> personaPatterns = new ArrayList<>();
    private List<String> personaConsistencyMarkers = new ArrayList<>();
    private List<String> toneIndicators = new ArrayList<>();
    private int minToneIndicators = 3;
    private int minTerminologyMatches = 2;
    private List<String> positiveTone = new ArrayList<>();
    private List<String> negativeTone = new ArrayList<>();
    private List<String> disrespectfulTerms = new ArrayList<>();
    private List<String> factualErrors = new ArrayList<>();

    private Map<String, LengthBounds> lengthBounds = new LinkedHashMap<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LengthBounds {
        private int minWords = 100;
        private int maxWords = 300;
    }

    public LengthBounds boundsFor(String serviceType) {
        LengthBounds bounds = serviceType == null ? null : lengthBounds.get(serviceType);
        if (bounds == null) {
            bounds = lengthBounds.get(DEFAULT_SERVICE);
        }
        return bounds == null ? new LengthBounds() : bounds;
    }

    public static QualityLexicon load(Resource resource, ObjectMapper objectMapper) {
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, QualityLexicon.class);
        } catch (IOException ex) {
            throw new IllegalStateException("Cannot load quality lexicon from " + resource.getDescription(), ex);
        }
    }

    public static QualityLexicon defaults() {
        return load(new ClassPathResource(DEFAULT_LOCATION), new ObjectMapper());
    }
}
