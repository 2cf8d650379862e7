package com.example.contentops.flowguard.validator;

import java.util.Map;
import reactor.core.publisher.Mono;

/** Stage-specific sanity checks applied to one stage's input and output. */
public interface StageValidator {

  /** Pipeline stage id this validator is registered under. */
  String stageId();

  /**
   * Inspects a stage run. Implementations must not mutate the supplied maps; stage duration is
   * measured by the caller.
   */
  Mono<StageCheck> validate(Map<String, Object> input, Map<String, Object> output,
      Map<String, Object> sessionContext);
}
