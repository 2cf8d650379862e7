package com.example.contentops.flowguard.quality;

import static com.example.contentops.flowguard.quality.QualityTestSupport.LEXICON;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.Map;
import org.junit.jupiter.api.Test;

class RelevanceScorersTest {

  private final DomainMatchScorer domain = new DomainMatchScorer(LEXICON);

  @Test
  void classifiesRequestsByFirstMatchingDomain() {
    assertThat(domain.classify("What does my career hold?")).isEqualTo("career_astrology");
    assertThat(domain.classify("When will I find love?")).isEqualTo("relationship_astrology");
    assertThat(domain.classify("Tell me about my chart")).isEqualTo("classical_astrology");
  }

  @Test
  void exactDomainMatchScoresOne() {
    Double score = domain.score(input("Is a new job coming?", "", "Your profession shifts this year")).block();

    assertThat(score).isEqualTo(1.0);
  }

  @Test
  void relatedDomainsEarnPartialCredit() {
    Double both = domain.score(input("Is a new job coming?", "", "Your nakshatra suggests a simple puja")).block();
    Double one = domain.score(input("Is a new job coming?", "", "Your nakshatra is strong")).block();

    assertThat(both).isEqualTo(0.5);
    assertThat(one).isEqualTo(0.25);
  }

  @Test
  void unrelatedKnowledgeScoresZero() {
    Double score = domain.score(input("What does my career hold?", "", "Evening skies are calm")).block();

    assertThat(score).isEqualTo(0.0);
  }

  @Test
  void keywordMatchIsJaccardOverlap() {
    KeywordMatchScorer keyword = new KeywordMatchScorer(LEXICON);

    Double score = keyword.score(input("Will my career and business grow?", "Your career will flourish", "")).block();

    assertThat(score).isEqualTo(0.5);
  }

  @Test
  void keywordsMatchAtWordStartOnly() {
    KeywordMatchScorer keyword = new KeywordMatchScorer(LEXICON);

    assertThat(keyword.keywords("Check the network")).isEmpty();
    assertThat(keyword.keywords("Planets and stars")).contains("planet", "star");
  }

  @Test
  void contextRelevanceCountsReferenceTermsUpToTheCap() {
    ContextRelevanceScorer context = new ContextRelevanceScorer(LEXICON);

    Double partial = context.score(input("q", "Sun and Moon in the tenth house", "")).block();
    Double capped = context.score(input("q", "Sun Moon Mars Mercury Jupiter Venus Saturn", "")).block();

    assertThat(partial).isEqualTo(0.6);
    assertThat(capped).isEqualTo(1.0);
  }

  @Test
  void authenticityIsBoostedForConfiguredRegions() {
    AuthenticityScorer authenticity = new AuthenticityScorer(LEXICON);
    ScoringInput plain = new ScoringInput("q", "Follow your dharma and karma", "", Map.of(), null);
    ScoringInput chennai = new ScoringInput("q", "Follow your dharma and karma", "",
        Map.of("location", "Chennai"), null);

    double base = 2.0 / LEXICON.getTerminology().size();
    assertThat(authenticity.score(plain).block()).isCloseTo(base, within(1e-9));
    assertThat(authenticity.score(chennai).block()).isCloseTo(base * 1.2, within(1e-9));
  }

  private static ScoringInput input(String request, String generated, String knowledge) {
    return new ScoringInput(request, generated, knowledge, Map.of(), null);
  }
}
