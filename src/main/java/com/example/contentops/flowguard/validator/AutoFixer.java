package com.example.contentops.flowguard.validator;

import java.util.Map;
import reactor.core.publisher.Mono;

/** Optional capability of a {@link StageValidator} for mechanically recoverable failures. */
public interface AutoFixer {

  Mono<AutoFixResult> autoFix(StageCheck check, Map<String, Object> sessionContext);
}
