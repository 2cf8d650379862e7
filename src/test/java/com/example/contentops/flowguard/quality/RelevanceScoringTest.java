package com.example.contentops.flowguard.quality;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.example.contentops.flowguard.config.MonitorProperties;
import com.example.contentops.flowguard.quality.QualityTestSupport.FixedScorer;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RelevanceScoringTest {

  private static final ScoringInput INPUT = new ScoringInput("q", "a", "k", Map.of(), null);

  @Test
  void compositeIsTheWeightedSum() {
    RelevanceScoring scoring = new RelevanceScoring(
        List.of(new FixedScorer("a", 0.5), new FixedScorer("b", 1.0)), Map.of("a", 0.4, "b", 0.6));

    RelevanceBreakdown breakdown = scoring.score(INPUT).block();

    assertThat(breakdown.composite()).isCloseTo(0.8, within(1e-9));
    assertThat(breakdown.scores()).containsEntry("a", 0.5).containsEntry("b", 1.0);
  }

  @Test
  void subScoresAreClamped() {
    RelevanceScoring scoring = new RelevanceScoring(List.of(new FixedScorer("a", 1.7)), Map.of("a", 1.0));

    assertThat(scoring.score(INPUT).block().composite()).isEqualTo(1.0);
  }

  @Test
  void weightsMustSumToOne() {
    assertThatThrownBy(() -> new RelevanceScoring(
        List.of(new FixedScorer("a", 0.5), new FixedScorer("b", 0.5)), Map.of("a", 0.5, "b", 0.6)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("sum to 1");
  }

  @Test
  void everyScorerNeedsAWeight() {
    assertThatThrownBy(() -> new RelevanceScoring(List.of(new FixedScorer("a", 0.5)), Map.of("b", 1.0)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("a");
  }

  @Test
  void defaultWeightsCoverTheBuiltInScorers() {
    RelevanceScoring scoring = new RelevanceScoring(QualityTestSupport.realScorers(), new MonitorProperties());

    assertThat(scoring.weights()).containsEntry("domain_match", 0.30).containsEntry("keyword_match", 0.25);
  }
}
