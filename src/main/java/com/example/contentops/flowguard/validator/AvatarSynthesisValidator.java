package com.example.contentops.flowguard.validator;

import com.example.contentops.flowguard.model.Severity;
import com.example.contentops.flowguard.util.PayloadUtils;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Avatar video is optional. When it is missing the voice asset produced earlier in the session can
 * stand in for it.
 */
@Component
public class AvatarSynthesisValidator implements StageValidator, AutoFixer {

  static final String STAGE_ID = "avatar";
  static final int MAX_DURATION_SECONDS = 300;

  @Override
  public String stageId() {
    return STAGE_ID;
  }

  @Override
  public Mono<StageCheck> validate(Map<String, Object> input, Map<String, Object> output,
      Map<String, Object> sessionContext) {
    return Mono.fromSupplier(() -> {
      Map<String, Object> expected = Map.of("videoFormat", "mp4", "maxDurationSeconds", MAX_DURATION_SECONDS);
      Object error = output == null ? null : output.get("error");
      if (error != null) {
        return StageCheck.fail(Severity.WARNING, "avatar_failed", "Avatar synthesis failed: " + error)
            .userImpact("Video guidance unavailable")
            .expected(expected)
            .actual(output)
            .autoFixable(true)
            .autoFixType("fallback_to_audio")
            .build();
      }
      if (PayloadUtils.text(output, "videoUrl").isEmpty()) {
        return StageCheck.fail(Severity.WARNING, "missing_video", "No video URL generated")
            .userImpact("Video guidance unavailable")
            .expected(expected)
            .actual(output)
            .autoFixable(true)
            .autoFixType("fallback_to_audio")
            .build();
      }
      List<String> warnings = new ArrayList<>();
      Number duration = PayloadUtils.number(output, "duration");
      if (duration != null && duration.doubleValue() > MAX_DURATION_SECONDS) {
        warnings.add("Video duration exceeds 5 minutes");
      }
      return StageCheck.pass(warnings, expected, output);
    });
  }

  @Override
  public Mono<AutoFixResult> autoFix(StageCheck check, Map<String, Object> sessionContext) {
    return Mono.fromSupplier(() -> {
      if (!"fallback_to_audio".equals(check.autoFixType())) {
        return AutoFixResult.notFixed("no remedy for " + check.issueType());
      }
      Object audioUrl = PayloadUtils.findDeep(sessionContext.get("voiceData"), "audioUrl");
      if (audioUrl == null) {
        return AutoFixResult.notFixed("no audio asset to substitute");
      }
      return AutoFixResult.fixed("fallback_to_audio", false, Map.of("audioUrl", audioUrl));
    });
  }
}
