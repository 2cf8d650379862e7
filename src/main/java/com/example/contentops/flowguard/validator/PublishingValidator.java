package com.example.contentops.flowguard.validator;

import com.example.contentops.flowguard.model.Severity;
import com.example.contentops.flowguard.util.PayloadUtils;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/** Checks a social-media post against the target platform's rules. */
@Component
public class PublishingValidator implements StageValidator, AutoFixer {

  static final String STAGE_ID = "publish";

  record PlatformRules(int charLimit, int maxHashtags, boolean hashtagsRequired, int postsPerHour) {
  }

  static final Map<String, PlatformRules> PLATFORMS = Map.of(
      "instagram", new PlatformRules(2_200, 30, true, 25),
      "facebook", new PlatformRules(63_206, 0, false, 10),
      "twitter", new PlatformRules(280, 2, true, 50),
      "youtube", new PlatformRules(5_000, 15, false, 5),
      "linkedin", new PlatformRules(3_000, 5, false, 10));

  static final List<String> DEFAULT_HASHTAGS = List.of("#spiritualguidance", "#vedicastrology",
      "#spiritualjourney", "#cosmicguidance", "#astrology", "#birthchart");

  @Override
  public String stageId() {
    return STAGE_ID;
  }

  @Override
  public Mono<StageCheck> validate(Map<String, Object> input, Map<String, Object> output,
      Map<String, Object> sessionContext) {
    return Mono.fromSupplier(() -> inspect(input, output));
  }

  private StageCheck inspect(Map<String, Object> input, Map<String, Object> output) {
    String platform = PayloadUtils.text(input, "platform");
    if (platform.isEmpty()) {
      platform = PayloadUtils.text(output, "platform");
    }
    if (platform.isEmpty()) {
      return StageCheck.fail(Severity.ERROR, "missing_platform", "No target platform given")
          .userImpact("Content is not published")
          .actual(output)
          .build();
    }
    platform = platform.toLowerCase(Locale.ROOT);
    PlatformRules rules = PLATFORMS.get(platform);
    if (rules == null) {
      return StageCheck.fail(Severity.ERROR, "unsupported_platform", "Unsupported platform: " + platform)
          .userImpact("Content is not published")
          .expected(Map.of("platforms", List.copyOf(PLATFORMS.keySet())))
          .actual(output)
          .build();
    }

    String content = PayloadUtils.text(input, "contentText", "content");
    Object rawHashtags = input == null ? null : input.get("hashtags");
    int hashtags = rawHashtags instanceof Collection<?> tags ? tags.size() : 0;
    Map<String, Object> expected = Map.of("charLimit", rules.charLimit(), "maxHashtags", rules.maxHashtags());
    Map<String, Object> actual = new LinkedHashMap<>();
    actual.put("platform", platform);
    actual.put("chars", content.length());
    actual.put("hashtags", hashtags);

    Object error = output == null ? null : output.get("error");
    if (error != null) {
      String lower = String.valueOf(error).toLowerCase(Locale.ROOT);
      if (lower.contains("expired") || lower.contains("token") || lower.contains("unauthorized")) {
        return StageCheck.fail(Severity.ERROR, "credential_expired", "Publishing credential rejected: " + error)
            .userImpact("Content is not published")
            .expected(expected)
            .actual(actual)
            .autoFixable(true)
            .autoFixType("refresh_credential")
            .build();
      }
      if (lower.contains("rate limit") || lower.contains("too many requests") || lower.contains("quota")) {
        return StageCheck.fail(Severity.ERROR, "rate_limited", "Platform rate limit hit: " + error)
            .userImpact("Publishing delayed")
            .expected(expected)
            .actual(actual)
            .autoFixable(true)
            .autoFixType("rate_limit_backoff")
            .build();
      }
      return StageCheck.fail(Severity.ERROR, "publish_failed", "Publishing failed: " + error)
          .userImpact("Content is not published")
          .expected(expected)
          .actual(actual)
          .build();
    }
    if (content.length() > rules.charLimit()) {
      return StageCheck.fail(Severity.ERROR, "content_too_long",
              "Content length (" + content.length() + ") exceeds " + platform + " limit (" + rules.charLimit() + ")")
          .userImpact("Platform rejects the post")
          .expected(expected)
          .actual(actual)
          .autoFixable(true)
          .autoFixType("truncate_content")
          .build();
    }
    if (hashtags == 0 && rules.hashtagsRequired()) {
      return StageCheck.fail(Severity.WARNING, "missing_hashtags", "No hashtags for " + platform)
          .userImpact("Reduced reach")
          .expected(expected)
          .actual(actual)
          .autoFixable(true)
          .autoFixType("default_hashtags")
          .build();
    }
    List<String> warnings = new ArrayList<>();
    if (hashtags > rules.maxHashtags()) {
      warnings.add("Too many hashtags for " + platform + " (" + hashtags + " > " + rules.maxHashtags() + ")");
    }
    return StageCheck.pass(warnings, expected, actual);
  }

  @Override
  public Mono<AutoFixResult> autoFix(StageCheck check, Map<String, Object> sessionContext) {
    return Mono.fromSupplier(() -> {
      String platform = String.valueOf(check.actual().getOrDefault("platform", ""));
      PlatformRules rules = PLATFORMS.get(platform);
      String fixType = check.autoFixType() == null ? "" : check.autoFixType();
      switch (fixType) {
        case "refresh_credential":
          return AutoFixResult.fixed(fixType, true, Map.of("platform", platform, "action", "refresh_oauth_token"));
        case "truncate_content":
          int limit = rules == null ? 280 : rules.charLimit();
          return AutoFixResult.fixed(fixType, true,
              Map.of("maxLength", limit, "strategy", "preserve_beginning_and_hashtags"));
        case "default_hashtags":
          int max = rules == null ? DEFAULT_HASHTAGS.size() : Math.min(rules.maxHashtags(), DEFAULT_HASHTAGS.size());
          return AutoFixResult.fixed(fixType, false, Map.of("hashtags", DEFAULT_HASHTAGS.subList(0, max)));
        case "rate_limit_backoff":
          int perHour = rules == null ? 10 : rules.postsPerHour();
          return AutoFixResult.fixed(fixType, true,
              Map.of("retryAfterSeconds", 3600 / perHour, "maxRetries", 3));
        default:
          return AutoFixResult.notFixed("no remedy for " + check.issueType());
      }
    });
  }
}
