package com.example.contentops.flowguard.validator;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.contentops.flowguard.model.Severity;
import java.util.Map;
import org.junit.jupiter.api.Test;

class KnowledgeRetrievalValidatorTest {

  private final KnowledgeRetrievalValidator validator = new KnowledgeRetrievalValidator();

  @Test
  void questionFromSessionContextIsEnough() {
    StageCheck check = validator.validate(Map.of(), Map.of("knowledge", "Saturn in the tenth house"),
        Map.of("userQuestion", "What about my career?")).block();

    assertThat(check.passed()).isTrue();
    assertThat(check.actual()).containsEntry("knowledgeChars", 25);
  }

  @Test
  void missingQuestionFails() {
    StageCheck check = validator.validate(Map.of(), Map.of("knowledge", "text"), Map.of()).block();

    assertThat(check.passed()).isFalse();
    assertThat(check.severity()).isEqualTo(Severity.ERROR);
    assertThat(check.issueType()).isEqualTo("missing_question");
  }

  @Test
  void emptyRetrievalIsCriticalAndRetriedWithEnhancedQuery() {
    StageCheck check = validator.validate(Map.of("question", "Will I marry?"), Map.of("knowledge", " "),
        Map.of()).block();

    assertThat(check.severity()).isEqualTo(Severity.CRITICAL);
    assertThat(check.issueType()).isEqualTo("no_knowledge");

    AutoFixResult fix = validator.autoFix(check,
        Map.of("userQuestion", "Will I marry?", "serviceType", "quick_guidance")).block();
    assertThat(fix.fixed()).isTrue();
    assertThat(fix.detail()).containsEntry("query", "Will I marry? (quick_guidance)");
  }

  @Test
  void oversizedRetrievalWarns() {
    StageCheck check = validator.validate(Map.of("question", "q"), Map.of("knowledge", "x".repeat(20_001)),
        Map.of()).block();

    assertThat(check.passed()).isTrue();
    assertThat(check.severity()).isEqualTo(Severity.WARNING);
  }
}
