package com.example.contentops.flowguard.validator;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.contentops.flowguard.model.Severity;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ExternalDataFetchValidatorTest {

  private final ExternalDataFetchValidator validator = new ExternalDataFetchValidator();

  @Test
  void completeChartPasses() {
    StageCheck check = validator.validate(input(), completeChart(), Map.of()).block();

    assertThat(check).isNotNull();
    assertThat(check.passed()).isTrue();
    assertThat(check.severity()).isEqualTo(Severity.NONE);
    assertThat(check.actual()).containsEntry("completenessScore", 1.0);
  }

  @Test
  void errorResponseIsCritical() {
    StageCheck check = validator.validate(input(), Map.of("error", "connection refused"), Map.of()).block();

    assertThat(check.passed()).isFalse();
    assertThat(check.severity()).isEqualTo(Severity.CRITICAL);
    assertThat(check.issueType()).isEqualTo("fetch_failed");
    assertThat(check.autoFixable()).isFalse();
  }

  @Test
  void rateLimitedFetchCanBeRetried() {
    StageCheck check = validator.validate(input(), Map.of("error", "Rate limit exceeded"), Map.of()).block();

    assertThat(check.autoFixable()).isTrue();
    AutoFixResult fix = validator.autoFix(check, Map.of()).block();
    assertThat(fix.fixed()).isTrue();
    assertThat(fix.fixType()).isEqualTo("retry_with_backoff");
    assertThat(fix.retryNeeded()).isTrue();
  }

  @Test
  void sparseChartIsIncompleteAndEnhanced() {
    StageCheck check = validator.validate(input(), Map.of("rasi", "mesha"), Map.of()).block();

    assertThat(check.passed()).isFalse();
    assertThat(check.severity()).isEqualTo(Severity.ERROR);
    assertThat(check.issueType()).isEqualTo("incomplete_data");
    assertThat(check.autoFixType()).isEqualTo("enhance_request");

    AutoFixResult fix = validator.autoFix(check, Map.of("birthDetails", Map.of("location", "Chennai"))).block();
    assertThat(fix.fixed()).isTrue();
    assertThat(fix.detail()).containsEntry("location", "Chennai").containsEntry("detailed", true);
  }

  @Test
  void missingBirthTimeIsOnlyAWarning() {
    Map<String, Object> input = Map.of("birthDetails", Map.of("date", "1990-01-01", "location", "Chennai"));

    StageCheck check = validator.validate(input, completeChart(), Map.of()).block();

    assertThat(check.passed()).isTrue();
    assertThat(check.severity()).isEqualTo(Severity.WARNING);
    assertThat(check.warnings()).containsExactly("Birth details missing 'time'");
  }

  @Test
  void partlyCompleteChartWarns() {
    Map<String, Object> chart = new LinkedHashMap<>(completeChart());
    chart.remove("houses");
    chart.remove("aspects");
    chart.remove("dashas");
    chart.put("planets", List.of(Map.of("name", "Sun"), Map.of("name", "Moon")));

    StageCheck check = validator.validate(input(), chart, Map.of()).block();

    // 4 fields + 2 of 9 planets out of 16
    assertThat(ExternalDataFetchValidator.completeness(chart)).isEqualTo(6.0 / 16);
    assertThat(check.passed()).isFalse();
    assertThat(check.issueType()).isEqualTo("incomplete_data");
  }

  static Map<String, Object> input() {
    return Map.of("birthDetails", Map.of("date", "1990-01-01", "time", "06:30", "location", "Chennai"));
  }

  static Map<String, Object> completeChart() {
    List<Map<String, Object>> planets = new ArrayList<>();
    for (String planet : ExternalDataFetchValidator.REQUIRED_PLANETS) {
      planets.add(Map.of("name", planet, "sign", "mesha"));
    }
    Map<String, Object> chart = new LinkedHashMap<>();
    chart.put("planets", planets);
    chart.put("nakshatra", "ashwini");
    chart.put("rasi", "mesha");
    chart.put("navamsa", "simha");
    chart.put("houses", List.of(1, 2, 3));
    chart.put("aspects", List.of("trine"));
    chart.put("dashas", List.of("saturn"));
    return chart;
  }
}
