package com.example.contentops.flowguard.validator;

import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Fallback remedies for auto-fixable failures of validators that do not implement
 * {@link AutoFixer}, including contained validator crashes.
 */
@Component
public class GenericAutoFixer implements AutoFixer {

  static final int BACKOFF_SECONDS = 30;

  @Override
  public Mono<AutoFixResult> autoFix(StageCheck check, Map<String, Object> sessionContext) {
    return Mono.fromSupplier(() -> remedy(check));
  }

  private AutoFixResult remedy(StageCheck check) {
    String text = ((check.issueType() == null ? "" : check.issueType()) + " "
        + (check.description() == null ? "" : check.description())).toLowerCase(Locale.ROOT);
    if (text.contains("timeout") || text.contains("rate limit") || text.contains("rate_limit")) {
      return AutoFixResult.fixed("retry_with_backoff", true,
          Map.of("backoffSeconds", BACKOFF_SECONDS, "maxRetries", 3));
    }
    if (text.contains("unavailable")) {
      return AutoFixResult.fixed("fallback_mode", false, Map.of("mode", "degraded"));
    }
    return AutoFixResult.notFixed("no generic remedy for " + check.issueType());
  }
}
