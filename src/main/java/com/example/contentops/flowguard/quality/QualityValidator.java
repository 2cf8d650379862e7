package com.example.contentops.flowguard.quality;

import com.example.contentops.flowguard.config.MonitorProperties;
import com.example.contentops.flowguard.context.ContextTracker;
import com.example.contentops.flowguard.context.IntegrityReport;
import com.example.contentops.flowguard.context.PipelineDefinition;
import com.example.contentops.flowguard.model.DataLossEvent;
import com.example.contentops.flowguard.model.Outcome;
import com.example.contentops.flowguard.model.QualityFinding;
import com.example.contentops.flowguard.model.QualityReport;
import com.example.contentops.flowguard.model.StageResult;
import com.example.contentops.flowguard.util.PayloadUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Post-hoc business validation of a whole session. Each sub-step reports independently; a sub-step
 * that crashes is reported as a single "validation system error" while the others still contribute.
 */
@Slf4j
@Service
public class QualityValidator {

    static final String SYSTEM_ERROR_TYPE = "validation_error";
    static final long ACCEPTABLE_DURATION_MS = 15_000;
    static final int COMPLETE_GUIDANCE_CHARS = 200;
    static final double UX_THRESHOLD = 0.7;
    static final double STRUCTURED_DATA_TARGET = 0.7;
    static final int MAX_RELEVANCE_SUGGESTIONS = 3;

    private final RelevanceScoring relevanceScoring;
    private final DomainMatchScorer domainClassifier;
    private final ResponseQualityChecklist responseChecklist;
    private final PersonaAuthenticityChecklist authenticityChecklist;
    private final ContextTracker contextTracker;
    private final PipelineDefinition pipeline;
    private final MonitorProperties.Thresholds thresholds;

    public QualityValidator(RelevanceScoring relevanceScoring,
                            DomainMatchScorer domainClassifier,
                            ResponseQualityChecklist responseChecklist,
                            PersonaAuthenticityChecklist authenticityChecklist,
                            ContextTracker contextTracker,
                            PipelineDefinition pipeline,
                            MonitorProperties props) {
        this.relevanceScoring = relevanceScoring;
        this.domainClassifier = domainClassifier;
        this.responseChecklist = responseChecklist;
        this.authenticityChecklist = authenticityChecklist;
        this.contextTracker = contextTracker;
        this.pipeline = pipeline;
        this.thresholds = props.getThresholds();
    }

    public Mono<QualityReport> validate(QualityInput input) {
        List<Mono<StepReport>> steps = List.of(
                step("integration_chain", () -> Mono.fromSupplier(() -> chainCompleteness(input))),
                step("structured_data", () -> Mono.fromSupplier(() -> structuredData(input))),
                step("relevance", () -> relevance(input)),
                step("response_quality", () -> Mono.fromSupplier(() -> responseQuality(input))),
                step("persona_authenticity", () -> Mono.fromSupplier(() -> authenticity(input))),
                step("context_preservation", () -> Mono.fromSupplier(() -> contextPreservation(input))),
                step("user_experience", () -> Mono.fromSupplier(() -> userExperience(input))));
        return Flux.concat(steps)
                .collectList()
                .map(reports -> merge(input.sessionId(), reports));
    }

    private Mono<StepReport> step(String name, Supplier<Mono<StepReport>> body) {
        return Mono.defer(body)
                .onErrorResume(ex -> {
                    log.error("[quality] sub-step {} failed: {}", name, ex.toString(), ex);
                    StepReport report = new StepReport(name);
                    report.systemError = true;
                    return Mono.just(report);
                });
    }

    private StepReport chainCompleteness(QualityInput input) {
        StepReport report = new StepReport("integration_chain");
        Map<String, StageResult> latest = latestByStage(input.stageResults());
        List<String> required = pipeline.requiredStageIds();
        List<String> missing = new ArrayList<>();
        for (String stageId : required) {
            StageResult result = latest.get(stageId);
            if (result == null) {
                missing.add(stageId);
            } else if (!result.passed()) {
                missing.add(stageId + " (failed)");
            }
        }
        double completeness = required.isEmpty() ? 100.0
                : (required.size() - missing.size()) * 100.0 / required.size();
        report.scores.put("chain_completeness", completeness);
        if (!missing.isEmpty()) {
            report.critical.add(new QualityFinding("integration_chain",
                    "Missing required stages: " + String.join(", ", missing),
                    "User will not receive complete guidance"));
            report.recommendations.add("Fix missing stages in the guidance flow");
        }
        return report;
    }

    private StepReport structuredData(QualityInput input) {
        StepReport report = new StepReport("structured_data");
        StageResult fetch = latestByStage(input.stageResults()).get(pipeline.stageIds().get(0));
        if (fetch == null) {
            return report;
        }
        Number completeness = PayloadUtils.number(fetch.actual(), "completenessScore");
        double score = completeness != null ? completeness.doubleValue() : (fetch.passed() ? 1.0 : 0.0);
        report.scores.put("structured_data", TextSignals.clamp(score));
        if (score < STRUCTURED_DATA_TARGET) {
            report.warnings.add(new QualityFinding("structured_data",
                    "Profile data only " + Math.round(score * 100) + "% complete",
                    "Guidance may miss personal details"));
        }
        return report;
    }

    private Mono<StepReport> relevance(QualityInput input) {
        return relevanceScoring.score(input.scoringInput()).map(breakdown -> {
            StepReport report = new StepReport("relevance");
            report.scores.putAll(breakdown.scores());
            report.scores.put("relevance", breakdown.composite());
            if (breakdown.composite() <= thresholds.getRelevance()) {
                report.errorLevelFailure = true;
                report.warnings.add(new QualityFinding("relevance",
                        String.format("Knowledge and guidance not relevant to the request (score: %.2f)",
                                breakdown.composite()),
                        "User may receive generic instead of personalised guidance"));
                report.recommendations.add("Enhance knowledge query generation for better retrieval");
                report.recommendations.addAll(relevanceSuggestions(input, breakdown));
            }
            return report;
        });
    }

    private List<String> relevanceSuggestions(QualityInput input, RelevanceBreakdown breakdown) {
        List<String> suggestions = new ArrayList<>();
        if (breakdown.score(KeywordMatchScorer.NAME) < 0.5) {
            suggestions.add("Enhance keyword extraction to better match user questions");
        }
        if (breakdown.score(DomainMatchScorer.NAME) < 0.5) {
            suggestions.add("Query '" + domainClassifier.classify(input.request()) + "' domain more specifically");
        }
        if (breakdown.score(ContextRelevanceScorer.NAME) < 0.5) {
            suggestions.add("Include more profile context in knowledge queries");
        }
        if (breakdown.score(SemanticSimilarityScorer.NAME) < 0.6) {
            suggestions.add("Use semantic search enhancements for better relevance");
        }
        if (breakdown.score(AuthenticityScorer.NAME) < 0.5) {
            suggestions.add("Prioritize Tamil/Vedic cultural knowledge sources");
        }
        return suggestions.subList(0, Math.min(MAX_RELEVANCE_SUGGESTIONS, suggestions.size()));
    }

    private StepReport responseQuality(QualityInput input) {
        StepReport report = new StepReport("response_quality");
        if (input.generatedText().isBlank()) {
            report.scores.put("response_quality", 0.0);
            report.errorLevelFailure = true;
            report.warnings.add(new QualityFinding("response_quality", "No generated guidance to assess",
                    "User receives no guidance"));
            return report;
        }
        ChecklistResult result = responseChecklist.evaluate(input.generatedText(), input.knowledgeText(),
                input.profile(), input.serviceType());
        report.scores.put("response_quality", result.score());
        if (result.score() < thresholds.getResponseQuality()) {
            report.errorLevelFailure = true;
            report.warnings.add(new QualityFinding("response_quality",
                    String.format("Low quality response (score: %.2f)", result.score()),
                    "User receives low quality guidance"));
            report.recommendations.add("Improve the generation prompt to ensure context usage");
            report.recommendations.addAll(result.suggestions());
        }
        return report;
    }

    private StepReport authenticity(QualityInput input) {
        StepReport report = new StepReport("persona_authenticity");
        ChecklistResult result = authenticityChecklist.evaluate(input.generatedText());
        report.scores.put("persona_authenticity", result.score());
        if (result.score() < thresholds.getAuthenticity()) {
            report.warnings.add(new QualityFinding("persona_authenticity",
                    String.format("Low persona authenticity (score: %.2f)", result.score()),
                    "Guidance may feel generic"));
            report.recommendations.add("Enhance persona authenticity with more Tamil/Vedic references");
            report.recommendations.addAll(result.suggestions());
        }
        return report;
    }

    private StepReport contextPreservation(QualityInput input) {
        StepReport report = new StepReport("context_preservation");
        Outcome<IntegrityReport> outcome = contextTracker.validateIntegrity(input.sessionId());
        if (!outcome.success()) {
            throw new IllegalStateException("integrity check unavailable: " + outcome.error());
        }
        IntegrityReport integrity = outcome.value();
        report.scores.put("integrity", integrity.score());
        if (integrity.dataLossDetected()) {
            report.errorLevelFailure = true;
            Set<String> lost = integrity.dataLossEvents().stream()
                    .map(DataLossEvent::field)
                    .collect(Collectors.toCollection(LinkedHashSet::new));
            report.warnings.add(new QualityFinding("context_preservation",
                    "Critical context lost between stages: " + String.join(", ", lost),
                    "Personalised guidance may be compromised"));
            report.recommendations.add("Pass critical fields through every stage: " + String.join(", ", lost));
        }
        return report;
    }

    private StepReport userExperience(QualityInput input) {
        StepReport report = new StepReport("user_experience");
        String response = TextSignals.lower(input.generatedText());
        boolean fastEnough = input.totalDurationMs() < ACCEPTABLE_DURATION_MS;
        boolean complete = input.generatedText().length() > COMPLETE_GUIDANCE_CHARS;
        boolean profileMentioned = TextSignals.containsTerm(response, "birth")
                || TextSignals.containsTerm(response, "nakshatra");
        boolean questionAddressed = false;
        for (String word : TextSignals.tokens(TextSignals.lower(input.request()))) {
            if (word.length() > 3 && TextSignals.containsTerm(response, word)) {
                questionAddressed = true;
                break;
            }
        }
        double personalization = ((profileMentioned ? 1.0 : 0.0) + (questionAddressed ? 1.0 : 0.0)) / 2;
        double overall = ((fastEnough ? 1 : 0) + (complete ? 1 : 0) + (personalization > 0.5 ? 1 : 0)) / 3.0;
        report.scores.put("user_experience", overall);
        if (overall < UX_THRESHOLD) {
            report.warnings.add(new QualityFinding("user_experience", "User experience quality below threshold",
                    "Slow or impersonal guidance"));
            if (!fastEnough) {
                report.recommendations.add("Optimize stage performance for faster response times");
            }
        }
        return report;
    }

    private QualityReport merge(String sessionId, List<StepReport> reports) {
        List<QualityFinding> critical = new ArrayList<>();
        List<QualityFinding> warnings = new ArrayList<>();
        Map<String, Double> scores = new LinkedHashMap<>();
        Set<String> recommendations = new LinkedHashSet<>();
        List<String> crashed = new ArrayList<>();
        boolean errorLevelFailure = false;
        for (StepReport report : reports) {
            if (report.systemError) {
                crashed.add(report.name);
                continue;
            }
            critical.addAll(report.critical);
            warnings.addAll(report.warnings);
            scores.putAll(report.scores);
            recommendations.addAll(report.recommendations);
            errorLevelFailure |= report.errorLevelFailure;
        }
        if (!crashed.isEmpty()) {
            critical.add(new QualityFinding(SYSTEM_ERROR_TYPE,
                    "Validation system error in: " + String.join(", ", crashed),
                    "Cannot validate guidance quality"));
        }
        boolean overallValid = critical.isEmpty() && !errorLevelFailure;
        log.info("[quality] session={} overallValid={} critical={} warnings={}",
                sessionId, overallValid, critical.size(), warnings.size());
        return new QualityReport(overallValid, critical, warnings, scores, new ArrayList<>(recommendations));
    }

    private static Map<String, StageResult> latestByStage(List<StageResult> results) {
        Map<String, StageResult> latest = new LinkedHashMap<>();
        for (StageResult result : results) {
            latest.put(result.stageId(), result);
        }
        return latest;
    }

    private static final class StepReport {
        final String name;
        final List<QualityFinding> critical = new ArrayList<>();
        final List<QualityFinding> warnings = new ArrayList<>();
        final Map<String, Double> scores = new LinkedHashMap<>();
        final List<String> recommendations = new ArrayList<>();
        boolean errorLevelFailure;
        boolean systemError;

        StepReport(String name) {
            this.name = name;
        }
    }
}
