package com.example.contentops.flowguard.validator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

class StageValidatorRegistryTest {

  @Test
  void indexesValidatorsAndDetectsAutoFixers() {
    StageValidatorRegistry registry = new StageValidatorRegistry(List.of(
        new ExternalDataFetchValidator(), new PlainValidator("translate")));

    assertThat(registry.stageIds()).containsExactly("fetch", "translate");
    assertThat(registry.find("fetch")).isPresent();
    assertThat(registry.autoFixer("fetch")).isPresent();
    assertThat(registry.find("translate")).isPresent();
    assertThat(registry.autoFixer("translate")).isEmpty();
    assertThat(registry.find("unknown")).isEmpty();
  }

  @Test
  void duplicateStageIdIsRejected() {
    assertThatThrownBy(() -> new StageValidatorRegistry(List.of(
        new PlainValidator("fetch"), new ExternalDataFetchValidator())))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("fetch");
  }

  @Test
  void blankStageIdIsRejected() {
    assertThatThrownBy(() -> new StageValidatorRegistry(List.of(new PlainValidator(" "))))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private record PlainValidator(String stageId) implements StageValidator {

    @Override
    public Mono<StageCheck> validate(Map<String, Object> input, Map<String, Object> output,
        Map<String, Object> sessionContext) {
      return Mono.just(StageCheck.pass(List.of(), Map.of(), Map.of()));
    }
  }
}
