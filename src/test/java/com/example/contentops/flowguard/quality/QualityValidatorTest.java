package com.example.contentops.flowguard.quality;

import static com.example.contentops.flowguard.quality.QualityTestSupport.GUIDANCE;
import static com.example.contentops.flowguard.quality.QualityTestSupport.KNOWLEDGE;
import static com.example.contentops.flowguard.quality.QualityTestSupport.LEXICON;
import static org.assertj.core.api.Assertions.assertThat;

import com.example.contentops.flowguard.MutableClock;
import com.example.contentops.flowguard.config.MonitorProperties;
import com.example.contentops.flowguard.context.ContextTracker;
import com.example.contentops.flowguard.context.PipelineDefinition;
import com.example.contentops.flowguard.model.QualityFinding;
import com.example.contentops.flowguard.model.QualityReport;
import com.example.contentops.flowguard.model.StageResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class QualityValidatorTest {

  private final MonitorProperties props = new MonitorProperties();
  private final PipelineDefinition pipeline = PipelineDefinition.defaults();
  private ContextTracker tracker;

  @BeforeEach
  void setUp() {
    tracker = new ContextTracker(pipeline, props, new ObjectMapper(), MutableClock.at("2024-05-01T10:00:00Z"));
    tracker.initialize("s-1", Map.of("userQuestion", "What does my career hold?", "serviceType", "quick_guidance"));
  }

  @Test
  void offTopicGuidanceFailsRelevanceWithDomainRecommendation() {
    QualityValidator validator = validator(new RelevanceScoring(QualityTestSupport.realScorers(), props));
    QualityInput input = input("The stars shine brightly tonight. Trust your heart and stay patient with loved ones.",
        "Evening skies are calm and bright.");

    QualityReport report = validator.validate(input).block();

    assertThat(report).isNotNull();
    assertThat(report.qualityScores().get("domain_match")).isEqualTo(0.0);
    assertThat(report.qualityScores().get("relevance")).isLessThan(0.65);
    assertThat(report.overallValid()).isFalse();
    assertThat(report.hasCriticalIssues()).isFalse();
    assertThat(report.recommendations())
        .contains("Enhance knowledge query generation for better retrieval")
        .contains("Query 'career_astrology' domain more specifically");
    assertThat(report.warnings()).extracting(QualityFinding::type).contains("relevance");
  }

  @Test
  void wellGroundedGuidanceIsValid() {
    QualityValidator validator = validator(fixedRelevance(0.9));

    QualityReport report = validator.validate(input(GUIDANCE, KNOWLEDGE)).block();

    assertThat(report.overallValid()).isTrue();
    assertThat(report.criticalIssues()).isEmpty();
    assertThat(report.qualityScores())
        .containsEntry("response_quality", 1.0)
        .containsEntry("persona_authenticity", 1.0)
        .containsEntry("integrity", 100.0)
        .containsEntry("chain_completeness", 100.0);
  }

  @Test
  void relevanceExactlyAtThresholdFails() {
    QualityValidator validator = validator(fixedRelevance(0.65));

    QualityReport report = validator.validate(input(GUIDANCE, KNOWLEDGE)).block();

    assertThat(report.overallValid()).isFalse();
    assertThat(report.warnings()).extracting(QualityFinding::type).containsExactly("relevance");
  }

  @Test
  void lowAuthenticityOnlyWarns() {
    QualityValidator validator = validator(fixedRelevance(0.9));
    String guidance = GUIDANCE.replace("My child, the", "The") + " Ignore the nonsense of doubters.";

    QualityReport report = validator.validate(input(guidance, KNOWLEDGE)).block();

    assertThat(report.qualityScores().get("persona_authenticity")).isLessThan(0.8);
    assertThat(report.warnings()).extracting(QualityFinding::type).containsExactly("persona_authenticity");
    assertThat(report.overallValid()).isTrue();
  }

  @Test
  void missingRequiredStageIsCritical() {
    QualityValidator validator = validator(fixedRelevance(0.9));
    QualityInput input = input(GUIDANCE, KNOWLEDGE).toBuilder()
        .stageResults(List.of(passed("fetch", Map.of("completenessScore", 1.0)), passed("knowledge", Map.of())))
        .build();

    QualityReport report = validator.validate(input).block();

    assertThat(report.criticalIssues()).singleElement()
        .satisfies(finding -> {
          assertThat(finding.type()).isEqualTo("integration_chain");
          assertThat(finding.description()).contains("generate");
        });
    assertThat(report.overallValid()).isFalse();
  }

  @Test
  void crashedSubStepBecomesOneSystemErrorWhileOthersStillReport() {
    QualityValidator validator = validator(fixedRelevance(0.9));
    QualityInput input = input(GUIDANCE, KNOWLEDGE).toBuilder().sessionId("unknown-session").build();

    QualityReport report = validator.validate(input).block();

    assertThat(report.criticalIssues()).singleElement()
        .satisfies(finding -> {
          assertThat(finding.type()).isEqualTo("validation_error");
          assertThat(finding.description()).isEqualTo("Validation system error in: context_preservation");
        });
    assertThat(report.qualityScores()).containsKeys("relevance", "response_quality", "user_experience");
    assertThat(report.qualityScores()).doesNotContainKey("integrity");
  }

  @Test
  void emptyGuidanceFailsResponseQuality() {
    QualityValidator validator = validator(fixedRelevance(0.9));

    QualityReport report = validator.validate(input("", KNOWLEDGE)).block();

    assertThat(report.qualityScores()).containsEntry("response_quality", 0.0);
    assertThat(report.overallValid()).isFalse();
  }

  private QualityValidator validator(RelevanceScoring scoring) {
    return new QualityValidator(scoring, new DomainMatchScorer(LEXICON), new ResponseQualityChecklist(LEXICON),
        new PersonaAuthenticityChecklist(LEXICON), tracker, pipeline, props);
  }

  private static RelevanceScoring fixedRelevance(double value) {
    return new RelevanceScoring(List.of(new QualityTestSupport.FixedScorer("fixed", value)), Map.of("fixed", 1.0));
  }

  private static QualityInput input(String generated, String knowledge) {
    return QualityInput.builder()
        .sessionId("s-1")
        .request("What does my career hold?")
        .serviceType("quick_guidance")
        .profile(Map.of("date", "1990-01-01", "location", "Chennai"))
        .knowledgeText(knowledge)
        .generatedText(generated)
        .stageResults(List.of(
            passed("fetch", Map.of("completenessScore", 1.0)),
            passed("knowledge", Map.of()),
            passed("generate", Map.of())))
        .totalDurationMs(4_000)
        .build();
  }

  private static StageResult passed(String stageId, Map<String, Object> actual) {
    return StageResult.builder().stageId(stageId).passed(true).actual(actual).build();
  }
}
