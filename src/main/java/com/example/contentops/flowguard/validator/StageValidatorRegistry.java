package com.example.contentops.flowguard.validator;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.support.AopUtils;
import org.springframework.stereotype.Component;

/**
 * Indexes the registered {@link StageValidator} beans by stage id. The {@link AutoFixer} capability
 * is detected once here instead of on every failure.
 */
@Slf4j
@Component
public class StageValidatorRegistry {

  private final Map<String, StageValidator> validators = new LinkedHashMap<>();
  private final Map<String, AutoFixer> autoFixers = new LinkedHashMap<>();

  public StageValidatorRegistry(List<StageValidator> stageValidators) {
    List<StageValidator> safe = stageValidators == null ? List.of() : stageValidators;
    safe.stream().filter(Objects::nonNull).forEach(this::register);
    log.info("[validators] registered stages={} autoFix={}", validators.keySet(), autoFixers.keySet());
  }

  private void register(StageValidator validator) {
    String stageId = validator.stageId();
    if (stageId == null || stageId.isBlank()) {
      throw new IllegalArgumentException(
          "Validator " + AopUtils.getTargetClass(validator).getSimpleName() + " has no stage id");
    }
    StageValidator previous = validators.putIfAbsent(stageId, validator);
    if (previous != null) {
      throw new IllegalArgumentException("Duplicate validators for stage '" + stageId + "': "
          + AopUtils.getTargetClass(previous).getSimpleName() + ", "
          + AopUtils.getTargetClass(validator).getSimpleName());
    }
    if (validator instanceof AutoFixer fixer) {
      autoFixers.put(stageId, fixer);
    }
  }

  public Optional<StageValidator> find(String stageId) {
    return Optional.ofNullable(validators.get(stageId));
  }

  public Optional<AutoFixer> autoFixer(String stageId) {
    return Optional.ofNullable(autoFixers.get(stageId));
  }

  public Set<String> stageIds() {
    return validators.keySet();
  }
}
