package com.example.contentops.flowguard.validator;

import com.example.contentops.flowguard.model.Severity;
import com.example.contentops.flowguard.util.PayloadUtils;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/** Knowledge retrieval must answer a question and return some text. */
@Component
public class KnowledgeRetrievalValidator implements StageValidator, AutoFixer {

  static final String STAGE_ID = "knowledge";
  static final int MAX_KNOWLEDGE_CHARS = 20_000;

  @Override
  public String stageId() {
    return STAGE_ID;
  }

  @Override
  public Mono<StageCheck> validate(Map<String, Object> input, Map<String, Object> output,
      Map<String, Object> sessionContext) {
    return Mono.fromSupplier(() -> {
      String question = PayloadUtils.text(input, "question", "userQuestion");
      if (question.isEmpty()) {
        question = PayloadUtils.text(sessionContext, "userQuestion");
      }
      String knowledge = PayloadUtils.text(output, "knowledge", "retrievedText", "text");
      Map<String, Object> expected = Map.of("maxKnowledgeChars", MAX_KNOWLEDGE_CHARS);
      Map<String, Object> actual = Map.of("knowledgeChars", knowledge.length());

      if (question.isEmpty()) {
        return StageCheck.fail(Severity.ERROR, "missing_question", "No user question found")
            .userImpact("Knowledge cannot be matched to the request")
            .expected(expected)
            .actual(actual)
            .build();
      }
      if (knowledge.isEmpty()) {
        return StageCheck.fail(Severity.CRITICAL, "no_knowledge", "No knowledge retrieved")
            .userImpact("Generic guidance instead of personalised knowledge")
            .expected(expected)
            .actual(actual)
            .autoFixable(true)
            .autoFixType("retry_with_enhanced_query")
            .build();
      }
      List<String> warnings = new ArrayList<>();
      if (knowledge.length() > MAX_KNOWLEDGE_CHARS) {
        warnings.add("Retrieved knowledge is unusually large (" + knowledge.length() + " chars)");
      }
      return StageCheck.pass(warnings, expected, actual);
    });
  }

  @Override
  public Mono<AutoFixResult> autoFix(StageCheck check, Map<String, Object> sessionContext) {
    return Mono.fromSupplier(() -> {
      if (!"retry_with_enhanced_query".equals(check.autoFixType())) {
        return AutoFixResult.notFixed("no remedy for " + check.issueType());
      }
      String question = PayloadUtils.text(sessionContext, "userQuestion");
      String serviceType = PayloadUtils.text(sessionContext, "serviceType");
      String enhanced = serviceType.isEmpty() ? question : question + " (" + serviceType + ")";
      return AutoFixResult.fixed("retry_with_enhanced_query", true,
          Map.of("query", enhanced.trim(), "topK", 10));
    });
  }
}
