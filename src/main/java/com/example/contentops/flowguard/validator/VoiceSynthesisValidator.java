package com.example.contentops.flowguard.validator;

import com.example.contentops.flowguard.model.Severity;
import com.example.contentops.flowguard.util.PayloadUtils;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/** Voice synthesis is optional, so every failure here is a warning. */
@Component
public class VoiceSynthesisValidator implements StageValidator, AutoFixer {

  static final String STAGE_ID = "voice";
  static final int MAX_DURATION_SECONDS = 300;

  @Override
  public String stageId() {
    return STAGE_ID;
  }

  @Override
  public Mono<StageCheck> validate(Map<String, Object> input, Map<String, Object> output,
      Map<String, Object> sessionContext) {
    return Mono.fromSupplier(() -> {
      Map<String, Object> expected = Map.of("audioFormat", "mp3", "maxDurationSeconds", MAX_DURATION_SECONDS);
      Object error = output == null ? null : output.get("error");
      if (error != null) {
        boolean quota = String.valueOf(error).toLowerCase(Locale.ROOT).contains("quota");
        return StageCheck.fail(Severity.WARNING, "voice_failed", "Voice synthesis failed: " + error)
            .userImpact("Guidance delivered as text only")
            .expected(expected)
            .actual(output)
            .autoFixable(quota)
            .autoFixType(quota ? "fallback_to_text" : null)
            .build();
      }
      String audioUrl = PayloadUtils.text(output, "audioUrl", "voiceUrl");
      if (audioUrl.isEmpty()) {
        return StageCheck.fail(Severity.WARNING, "missing_audio", "No audio URL generated")
            .userImpact("Guidance delivered as text only")
            .expected(expected)
            .actual(output)
            .autoFixable(true)
            .autoFixType("fallback_to_text")
            .build();
      }
      List<String> warnings = new ArrayList<>();
      Number duration = PayloadUtils.number(output, "duration");
      if (duration != null) {
        if (duration.doubleValue() <= 0) {
          warnings.add("Invalid audio duration");
        } else if (duration.doubleValue() > MAX_DURATION_SECONDS) {
          warnings.add("Audio duration exceeds 5 minutes");
        }
      }
      return StageCheck.pass(warnings, expected, output);
    });
  }

  @Override
  public Mono<AutoFixResult> autoFix(StageCheck check, Map<String, Object> sessionContext) {
    return Mono.fromSupplier(() -> "fallback_to_text".equals(check.autoFixType())
        ? AutoFixResult.fixed("fallback_to_text", false, Map.of("deliverAs", "text"))
        : AutoFixResult.notFixed("no remedy for " + check.issueType()));
  }
}
