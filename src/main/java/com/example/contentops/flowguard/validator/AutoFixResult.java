package com.example.contentops.flowguard.validator;

import com.example.contentops.flowguard.util.PayloadUtils;
import java.util.Map;

/**
 * @param fixed       whether a remedy was found
 * @param fixType     remedy identifier, e.g. {@code retry_with_backoff}
 * @param retryNeeded whether the pipeline should re-run the stage with the remedy applied
 * @param detail      remedy parameters handed back to the pipeline
 */
public record AutoFixResult(boolean fixed, String fixType, boolean retryNeeded, Map<String, Object> detail) {

  public AutoFixResult {
    detail = PayloadUtils.immutableCopy(detail);
  }

  public static AutoFixResult fixed(String fixType, boolean retryNeeded, Map<String, Object> detail) {
    return new AutoFixResult(true, fixType, retryNeeded, detail);
  }

  public static AutoFixResult notFixed(String reason) {
    return new AutoFixResult(false, null, false, Map.of("reason", reason));
  }
}
