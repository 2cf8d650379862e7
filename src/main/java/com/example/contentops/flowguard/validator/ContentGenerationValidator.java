package com.example.contentops.flowguard.validator;

import com.example.contentops.flowguard.model.Severity;
import com.example.contentops.flowguard.util.PayloadUtils;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/** Screens generated guidance for emptiness, harmful statements and size. */
@Component
public class ContentGenerationValidator implements StageValidator, AutoFixer {

  static final String STAGE_ID = "generate";
  static final int MAX_CHARS = 12_000;
  static final int MIN_WORDS = 50;
  static final int MAX_WORDS = 1_500;

  static final Map<String, List<String>> HARMFUL_PATTERNS = harmfulPatterns();

  @Override
  public String stageId() {
    return STAGE_ID;
  }

  @Override
  public Mono<StageCheck> validate(Map<String, Object> input, Map<String, Object> output,
      Map<String, Object> sessionContext) {
    return Mono.fromSupplier(() -> inspect(output));
  }

  private StageCheck inspect(Map<String, Object> output) {
    String content = PayloadUtils.text(output, "content", "response", "guidance", "text");
    int words = PayloadUtils.wordCount(content);
    Map<String, Object> expected = Map.of("maxChars", MAX_CHARS, "minWords", MIN_WORDS, "maxWords", MAX_WORDS);
    Map<String, Object> actual = Map.of("chars", content.length(), "words", words);

    if (content.isBlank()) {
      return StageCheck.fail(Severity.CRITICAL, "empty_content", "Generated content is empty")
          .userImpact("User receives no guidance")
          .expected(expected)
          .actual(actual)
          .build();
    }
    String lower = content.toLowerCase(Locale.ROOT);
    for (Map.Entry<String, List<String>> category : HARMFUL_PATTERNS.entrySet()) {
      for (String pattern : category.getValue()) {
        if (lower.contains(pattern)) {
          return StageCheck.fail(Severity.CRITICAL, "harmful_content",
                  "Harmful content detected (" + category.getKey() + "): contains '" + pattern + "'")
              .userImpact("Potentially harmful guidance delivered to the user")
              .expected(expected)
              .actual(actual)
              .build();
        }
      }
    }
    if (content.length() > MAX_CHARS) {
      return StageCheck.fail(Severity.ERROR, "content_too_large",
              "Generated content is " + content.length() + " chars, limit " + MAX_CHARS)
          .userImpact("Downstream media synthesis may fail or truncate")
          .expected(expected)
          .actual(actual)
          .autoFixable(true)
          .autoFixType("truncate_payload")
          .build();
    }
    List<String> warnings = new ArrayList<>();
    if (words < MIN_WORDS) {
      warnings.add("Content is short (" + words + " words)");
    } else if (words > MAX_WORDS) {
      warnings.add("Content is long (" + words + " words)");
    }
    return StageCheck.pass(warnings, expected, actual);
  }

  @Override
  public Mono<AutoFixResult> autoFix(StageCheck check, Map<String, Object> sessionContext) {
    return Mono.fromSupplier(() -> "truncate_payload".equals(check.autoFixType())
        ? AutoFixResult.fixed("truncate_payload", false,
            Map.of("maxChars", MAX_CHARS, "strategy", "sentence_boundary"))
        : AutoFixResult.notFixed("no remedy for " + check.issueType()));
  }

  private static Map<String, List<String>> harmfulPatterns() {
    Map<String, List<String>> patterns = new LinkedHashMap<>();
    patterns.put("medical_advice", List.of("stop taking medication", "ignore doctor", "cure disease",
        "treat illness", "medical diagnosis"));
    patterns.put("financial_scam", List.of("send money", "investment guarantee", "get rich quick",
        "financial miracle", "donate everything"));
    patterns.put("harmful_predictions", List.of("you will die", "death is near", "accident will happen",
        "tragedy awaits", "doomed to fail"));
    patterns.put("discrimination", List.of("caste superiority", "gender discrimination", "racial bias"));
    return patterns;
  }
}
