package com.example.contentops.flowguard.validator;

import com.example.contentops.flowguard.model.Severity;
import com.example.contentops.flowguard.util.PayloadUtils;
import java.util.List;
import java.util.Map;
import lombok.Builder;

/** Verdict of a {@link StageValidator}. */
@Builder(toBuilder = true)
public record StageCheck(
    boolean passed,
    Severity severity,
    String issueType,
    String description,
    String userImpact,
    Map<String, Object> expected,
    Map<String, Object> actual,
    boolean autoFixable,
    String autoFixType,
    List<String> warnings) {

  public StageCheck {
    severity = severity == null ? (passed ? Severity.NONE : Severity.ERROR) : severity;
    expected = PayloadUtils.immutableCopy(expected);
    actual = PayloadUtils.immutableCopy(actual);
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
  }

  /** Passing check; severity is WARNING when warnings were collected. */
  public static StageCheck pass(List<String> warnings, Map<String, Object> expected,
      Map<String, Object> actual) {
    boolean hasWarnings = warnings != null && !warnings.isEmpty();
    return StageCheck.builder()
        .passed(true)
        .severity(hasWarnings ? Severity.WARNING : Severity.NONE)
        .issueType(hasWarnings ? "warnings" : null)
        .description(hasWarnings ? String.join("; ", warnings) : null)
        .warnings(warnings)
        .expected(expected)
        .actual(actual)
        .build();
  }

  public static StageCheckBuilder fail(Severity severity, String issueType, String description) {
    return StageCheck.builder()
        .passed(false)
        .severity(severity)
        .issueType(issueType)
        .description(description);
  }
}
