package com.example.contentops.flowguard.quality;

import static com.example.contentops.flowguard.quality.QualityTestSupport.GUIDANCE;
import static com.example.contentops.flowguard.quality.QualityTestSupport.KNOWLEDGE;
import static com.example.contentops.flowguard.quality.QualityTestSupport.LEXICON;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class QualityChecklistsTest {

  private final ResponseQualityChecklist response = new ResponseQualityChecklist(LEXICON);
  private final PersonaAuthenticityChecklist persona = new PersonaAuthenticityChecklist(LEXICON);

  @Test
  void groundedGuidancePassesEveryResponseCheck() {
    ChecklistResult result = response.evaluate(GUIDANCE, KNOWLEDGE, Map.of("location", "Chennai"), "quick_guidance");

    assertThat(result.score()).isEqualTo(1.0);
    assertThat(result.suggestions()).isEmpty();
  }

  @Test
  void lengthBoundsDependOnTheService() {
    ChecklistResult detailed = response.evaluate(GUIDANCE, KNOWLEDGE, Map.of("location", "Chennai"),
        "detailed_reading");

    assertThat(detailed.passed(ResponseQualityChecklist.LENGTH_BOUNDS)).isFalse();
    assertThat(detailed.score()).isEqualTo(5.0 / 6);
    assertThat(detailed.suggestions()).containsExactly(
        "Keep the guidance within the word range expected for the service");
  }

  @Test
  void genericTextFailsMostChecks() {
    ChecklistResult result = response.evaluate("Things will be fine. Stay positive.", KNOWLEDGE, Map.of(), null);

    assertThat(result.score()).isEqualTo(0.0);
    assertThat(result.suggestions()).hasSize(6);
  }

  @Test
  void personaChecklistCatchesFactualAndRespectIssues() {
    ChecklistResult good = persona.evaluate(GUIDANCE);
    ChecklistResult bad = persona.evaluate("There are 13 zodiac signs and this is nonsense. Doom awaits.");

    assertThat(good.score()).isEqualTo(1.0);
    assertThat(bad.passed(PersonaAuthenticityChecklist.FACTUAL_ACCURACY)).isFalse();
    assertThat(bad.passed(PersonaAuthenticityChecklist.RESPECTFUL_LANGUAGE)).isFalse();
    assertThat(bad.passed(PersonaAuthenticityChecklist.APPROPRIATE_TONE)).isFalse();
    assertThat(bad.score()).isEqualTo(0.0);
  }
}
