package com.example.contentops.flowguard.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Binds properties under {@code flowguard.*}:
 *
 * flowguard.thresholds.relevance=0.65
 * flowguard.relevance-weights.domain-match=0.30
 * flowguard.pipeline[0].id=fetch
 * flowguard.health.interval=5m
 * flowguard.store.type=memory
 */
@Data
@Validated
@ConfigurationProperties(prefix = "flowguard")
public class MonitorProperties {

    @Valid
    private Thresholds thresholds = new Thresholds();

    @Valid
    private RelevanceWeights relevanceWeights = new RelevanceWeights();

    /**
     * Stage definitions in canonical pipeline order.
     */
    @Valid
    @NotEmpty
    private List<Stage> pipeline = defaultPipeline();

    @Valid
    private Health health = new Health();

    @Valid
    private Embedding embedding = new Embedding();

    @Valid
    private Store store = new Store();

    /**
     * Stages slower than this are called out in session recommendations.
     */
    @NotNull
    private Duration slowStageThreshold = Duration.ofSeconds(3);

    /**
     * Context keys never copied into snapshots.
     */
    private Set<String> binaryFields = new LinkedHashSet<>(List.of("audioData", "videoData", "imageData"));

    /**
     * Location of the heuristic vocabularies used by business validation.
     */
    @NotBlank
    private String lexiconLocation = "classpath:quality-lexicon.json";

    @Data
    public static class Thresholds {
        /** Relevance composite must be strictly above this value. */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double relevance = 0.65;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double responseQuality = 0.6;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double authenticity = 0.8;

        /** More non-critical stage failures than this turn a session PARTIAL. */
        @Min(0)
        private int partialFailureCount = 2;
    }

    @Data
    public static class RelevanceWeights {
        private double keywordMatch = 0.25;
        private double domainMatch = 0.30;
        private double contextRelevance = 0.20;
        private double semanticSimilarity = 0.15;
        private double authenticity = 0.10;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Stage {
        @NotBlank
        private String id;
        /** Key under which the stage output is stored in the session context. */
        private String contextKey;
        /** Fields this stage adds to the cumulative critical-field policy. */
        private List<String> requiredFields = new ArrayList<>();
        /** Whether the stage counts towards chain completeness. */
        private boolean required = true;
    }

    @Data
    public static class Health {
        private boolean enabled = true;
        @NotNull
        private Duration interval = Duration.ofMinutes(5);
        @NotNull
        private Duration initialDelay = Duration.ofSeconds(30);
        @NotNull
        private Duration primaryWindow = Duration.ofHours(1);
        @NotNull
        private Duration trendWindow = Duration.ofHours(24);
        /** Success rate (percent) below which a stage is in ERROR. */
        @DecimalMin("0.0")
        @DecimalMax("100.0")
        private double errorSuccessRate = 80.0;
        @Positive
        private int recentFailureLimit = 10;
    }

    @Data
    public static class Embedding {
        @Positive
        private int maxCallsPerMinute = 30;
        /** Texts are cut to this many characters before embedding. */
        @Positive
        private int maxInputChars = 8000;
        /** Embeddings kept in memory, keyed by text digest. */
        @Positive
        private int cacheSize = 10_000;
    }

    @Data
    public static class Store {
        /** memory or jdbc */
        @NotBlank
        private String type = "memory";
        /** Results kept per stage by the in-memory store. */
        @Positive
        private int maxResultsPerStage = 1000;
        /** Final session records kept by the in-memory store. */
        @Positive
        private int maxSessions = 10_000;
    }

    public static List<Stage> defaultPipeline() {
        List<Stage> stages = new ArrayList<>();
        stages.add(new Stage("fetch", "fetchData",
                new ArrayList<>(List.of("sessionId", "userId", "userQuestion", "serviceType", "birthDetails")), true));
        stages.add(new Stage("knowledge", "knowledgeData", new ArrayList<>(List.of("fetchData")), true));
        stages.add(new Stage("generate", "generatedContent", new ArrayList<>(List.of("knowledgeData")), true));
        stages.add(new Stage("voice", "voiceData", new ArrayList<>(List.of("generatedContent")), false));
        stages.add(new Stage("avatar", "avatarData", new ArrayList<>(List.of("voiceData")), false));
        stages.add(new Stage("publish", "publishResult", new ArrayList<>(List.of("platform")), false));
        return stages;
    }
}
