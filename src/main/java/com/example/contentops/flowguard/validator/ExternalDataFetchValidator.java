package com.example.contentops.flowguard.validator;

import com.example.contentops.flowguard.model.Severity;
import com.example.contentops.flowguard.util.PayloadUtils;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Checks the structured profile data (birth chart) returned by the external data provider.
 * Completeness is the share of required fields, required planets and supplementary sections present.
 */
@Component
public class ExternalDataFetchValidator implements StageValidator, AutoFixer {

  static final String STAGE_ID = "fetch";
  static final List<String> REQUIRED_FIELDS = List.of("planets", "nakshatra", "rasi", "navamsa");
  static final List<String> REQUIRED_PLANETS =
      List.of("sun", "moon", "mars", "mercury", "jupiter", "venus", "saturn", "rahu", "ketu");
  static final List<String> SUPPLEMENTARY_FIELDS = List.of("houses", "aspects", "dashas");
  static final List<String> BIRTH_DETAIL_FIELDS = List.of("date", "time", "location");
  static final double MIN_COMPLETENESS = 0.5;
  static final double TARGET_COMPLETENESS = 0.7;

  @Override
  public String stageId() {
    return STAGE_ID;
  }

  @Override
  public Mono<StageCheck> validate(Map<String, Object> input, Map<String, Object> output,
      Map<String, Object> sessionContext) {
    return Mono.fromSupplier(() -> inspect(input, output, sessionContext));
  }

  private StageCheck inspect(Map<String, Object> input, Map<String, Object> output,
      Map<String, Object> sessionContext) {
    Map<String, Object> expected = Map.of(
        "requiredFields", REQUIRED_FIELDS,
        "requiredPlanets", REQUIRED_PLANETS,
        "minimumCompleteness", TARGET_COMPLETENESS);

    Object error = output == null ? null : output.get("error");
    if (output == null || output.isEmpty() || error != null) {
      String reason = error == null ? "empty response" : String.valueOf(error);
      boolean rateLimited = reason.toLowerCase(Locale.ROOT).contains("rate limit");
      return StageCheck.fail(Severity.CRITICAL, "fetch_failed", "External data fetch failed: " + reason)
          .userImpact("Cannot provide accurate personalised guidance")
          .expected(expected)
          .actual(output)
          .autoFixable(rateLimited)
          .autoFixType(rateLimited ? "retry_with_backoff" : null)
          .build();
    }

    List<String> warnings = new ArrayList<>();
    Map<String, Object> birthDetails = PayloadUtils.asMap(input == null ? null : input.get("birthDetails"));
    if (birthDetails.isEmpty()) {
      birthDetails = PayloadUtils.asMap(sessionContext.get("birthDetails"));
    }
    for (String field : BIRTH_DETAIL_FIELDS) {
      if (PayloadUtils.isEmptyValue(birthDetails.get(field))) {
        warnings.add("Birth details missing '" + field + "'");
      }
    }

    double completeness = completeness(output);
    Map<String, Object> actual = new LinkedHashMap<>(output);
    actual.put("completenessScore", completeness);
    String percent = Math.round(completeness * 100) + "%";
    if (completeness < MIN_COMPLETENESS) {
      return StageCheck.fail(Severity.ERROR, "incomplete_data",
              "Incomplete data: profile only " + percent + " complete")
          .userImpact("Guidance may miss key profile details")
          .expected(expected)
          .actual(actual)
          .autoFixable(true)
          .autoFixType("enhance_request")
          .warnings(warnings)
          .build();
    }
    if (completeness < TARGET_COMPLETENESS) {
      warnings.add("Profile data only " + percent + " complete");
    }
    return StageCheck.pass(warnings, expected, actual);
  }

  static double completeness(Map<String, Object> output) {
    int total = 0;
    int present = 0;
    for (String field : REQUIRED_FIELDS) {
      total++;
      if (!PayloadUtils.isEmptyValue(output.get(field))) {
        present++;
      }
    }
    if (output.get("planets") instanceof Collection<?> planets) {
      Set<String> names = planets.stream()
          .map(PayloadUtils::asMap)
          .map(p -> String.valueOf(p.getOrDefault("name", "")).toLowerCase(Locale.ROOT))
          .collect(Collectors.toSet());
      for (String planet : REQUIRED_PLANETS) {
        total++;
        if (names.contains(planet)) {
          present++;
        }
      }
    }
    for (String field : SUPPLEMENTARY_FIELDS) {
      total++;
      if (!PayloadUtils.isEmptyValue(output.get(field))) {
        present++;
      }
    }
    return total == 0 ? 0.0 : (double) present / total;
  }

  @Override
  public Mono<AutoFixResult> autoFix(StageCheck check, Map<String, Object> sessionContext) {
    return Mono.fromSupplier(() -> {
      if ("retry_with_backoff".equals(check.autoFixType())) {
        return AutoFixResult.fixed("retry_with_backoff", true, Map.of("retryDelayMs", 2000));
      }
      if ("enhance_request".equals(check.autoFixType())) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("detailed", true);
        params.put("system", "vedic");
        Object location = PayloadUtils.asMap(sessionContext.get("birthDetails")).get("location");
        if (location != null) {
          params.put("location", location);
        }
        return AutoFixResult.fixed("enhance_request", true, params);
      }
      return AutoFixResult.notFixed("no remedy for " + check.issueType());
    });
  }
}
