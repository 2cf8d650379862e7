package com.example.contentops.flowguard.service;

import com.example.contentops.flowguard.alert.AlertSink;
import com.example.contentops.flowguard.config.MonitorProperties;
import com.example.contentops.flowguard.context.ContextTracker;
import com.example.contentops.flowguard.context.ContextUpdate;
import com.example.contentops.flowguard.context.IntegrityReport;
import com.example.contentops.flowguard.context.PipelineDefinition;
import com.example.contentops.flowguard.dao.MonitoringStore;
import com.example.contentops.flowguard.health.HealthAggregator;
import com.example.contentops.flowguard.health.SystemHealth;
import com.example.contentops.flowguard.model.AutoFixRecord;
import com.example.contentops.flowguard.model.DataLossEvent;
import com.example.contentops.flowguard.model.FailureReason;
import com.example.contentops.flowguard.model.Issue;
import com.example.contentops.flowguard.model.MonitoringSession;
import com.example.contentops.flowguard.model.Outcome;
import com.example.contentops.flowguard.model.QualityReport;
import com.example.contentops.flowguard.model.SessionMetrics;
import com.example.contentops.flowguard.model.SessionReport;
import com.example.contentops.flowguard.model.Severity;
import com.example.contentops.flowguard.model.StageResult;
import com.example.contentops.flowguard.quality.QualityInput;
import com.example.contentops.flowguard.quality.QualityValidator;
import com.example.contentops.flowguard.util.PayloadUtils;
import com.example.contentops.flowguard.validator.AutoFixResult;
import com.example.contentops.flowguard.validator.AutoFixer;
import com.example.contentops.flowguard.validator.GenericAutoFixer;
import com.example.contentops.flowguard.validator.StageCheck;
import com.example.contentops.flowguard.validator.StageValidator;
import com.example.contentops.flowguard.validator.StageValidatorRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Entry point of the engine. Owns the active sessions and routes every stage execution through
 * its validator, the context tracker and the store.
 *
 * <p>Every public operation resolves to an {@link Outcome}; internal errors are logged and turned
 * into {@link FailureReason#INTERNAL_ERROR} instead of erroring the returned Mono.
 */
@Slf4j
@Service
public class PipelineMonitor {

  static final String KNOWLEDGE_STAGE = "knowledge";
  static final String GENERATION_STAGE = "generate";
  static final String VALIDATOR_ERROR = "validator_error";
  static final String NO_VALIDATOR = "no_validator";

  private final Map<String, MonitoringSession> activeSessions = new ConcurrentHashMap<>();

  private final StageValidatorRegistry validators;
  private final GenericAutoFixer genericAutoFixer;
  private final ContextTracker contextTracker;
  private final QualityValidator qualityValidator;
  private final HealthAggregator healthAggregator;
  private final MonitoringStore store;
  private final AlertSink alertSink;
  private final PipelineDefinition pipeline;
  private final MonitorProperties props;
  private final Clock clock;

  public PipelineMonitor(StageValidatorRegistry validators,
      GenericAutoFixer genericAutoFixer,
      ContextTracker contextTracker,
      QualityValidator qualityValidator,
      HealthAggregator healthAggregator,
      MonitoringStore store,
      AlertSink alertSink,
      PipelineDefinition pipeline,
      MonitorProperties props,
      Clock clock) {
    this.validators = validators;
    this.genericAutoFixer = genericAutoFixer;
    this.contextTracker = contextTracker;
    this.qualityValidator = qualityValidator;
    this.healthAggregator = healthAggregator;
    this.store = store;
    this.alertSink = alertSink;
    this.pipeline = pipeline;
    this.props = props;
    this.clock = clock;
  }

  public Mono<Outcome<SessionReport>> startSession(String sessionId, String ownerId,
      Map<String, Object> initialContext) {
    return Mono.defer(() -> {
      if (sessionId == null || sessionId.isBlank()) {
        return Mono.just(Outcome.<SessionReport>failure(FailureReason.INVALID_INPUT, "Session id is required"));
      }
      MonitoringSession session = new MonitoringSession(sessionId, ownerId, clock.instant(),
          props.getThresholds().getPartialFailureCount());
      if (activeSessions.putIfAbsent(sessionId, session) != null) {
        log.warn("[monitor] duplicate session id={}", sessionId);
        return Mono.just(Outcome.<SessionReport>failure(FailureReason.DUPLICATE_SESSION,
            "Session " + sessionId + " is already active"));
      }
      Outcome<?> initialized = contextTracker.initialize(sessionId,
          initialContext == null ? Map.of() : initialContext);
      if (!initialized.success()) {
        activeSessions.remove(sessionId, session);
        return Mono.just(initialized.<SessionReport>castFailure());
      }
      log.info("[monitor] session started id={} owner={} stages={}", sessionId, ownerId, pipeline.stageIds());
      return Mono.just(Outcome.ok(liveReport(session)));
    }).onErrorResume(ex -> internalError("startSession", sessionId, ex));
  }

  /**
   * Validates one stage execution and records the result in the session.
   *
   * @param input      what the stage was handed
   * @param output     what the stage produced; a top-level key mapped to null drops that key from the context
   * @param durationMs how long the stage itself took
   */
  public Mono<Outcome<StageResult>> validateStage(String sessionId, String stageId,
      Map<String, Object> input, Map<String, Object> output, long durationMs) {
    MonitoringSession session = sessionId == null ? null : activeSessions.get(sessionId);
    if (session == null) {
      return Mono.just(notFound(sessionId));
    }
    if (stageId == null || stageId.isBlank()) {
      return Mono.just(Outcome.failure(FailureReason.INVALID_INPUT, "Stage id is required"));
    }
    Map<String, Object> stageInput = input == null ? Map.of() : input;
    Map<String, Object> stageOutput = output == null ? Map.of() : output;

    return Mono.defer(() -> {
      String anomaly = session.trackOrder(stageId, pipeline.indexOf(stageId));
      if (anomaly != null) {
        log.warn("[monitor] order anomaly session={}: {}", sessionId, anomaly);
      }
      Map<String, Object> sessionContext = contextTracker.currentContext(sessionId).toOptional().orElse(Map.of());
      long started = System.nanoTime();
      return runValidator(stageId, stageInput, stageOutput, sessionContext)
          .flatMap(check -> {
            long validationMs = (System.nanoTime() - started) / 1_000_000;
            Outcome<ContextUpdate> update = contextTracker.update(sessionId, stageId, stageInput, stageOutput);
            if (!update.success()) {
              log.warn("[monitor] context not updated session={} stage={}: {}", sessionId, stageId, update.error());
            }
            Map<String, Object> context = contextTracker.currentContext(sessionId).toOptional().orElse(Map.of());
            return autoFix(stageId, check, context)
                .map(fix -> record(session, stageId, check, fix, update.toOptional(), durationMs, validationMs));
          });
    })
        .doOnNext(this::persistAsync)
        .map(Outcome::ok)
        .onErrorResume(ex -> internalError("validateStage", sessionId, ex));
  }

  /** Runs the business checks over everything the session has produced so far. */
  public Mono<Outcome<QualityReport>> validateBusinessLogic(String sessionId) {
    MonitoringSession session = sessionId == null ? null : activeSessions.get(sessionId);
    if (session == null) {
      return Mono.just(notFound(sessionId));
    }
    return Mono.defer(() -> runBusinessValidation(session))
        .map(Outcome::ok)
        .onErrorResume(ex -> internalError("validateBusinessLogic", sessionId, ex));
  }

  /**
   * Finalizes the session: business validation when it has not run yet, metrics, recommendations
   * and the persisted final record. The session stays active when the final write fails.
   */
  public Mono<Outcome<SessionReport>> completeSession(String sessionId) {
    MonitoringSession session = sessionId == null ? null : activeSessions.get(sessionId);
    if (session == null) {
      return Mono.just(notFound(sessionId));
    }
    Mono<Optional<QualityReport>> business = session.isBusinessValidated()
        ? Mono.just(Optional.ofNullable(session.getQualityReport()))
        : Mono.defer(() -> runBusinessValidation(session))
            .map(Optional::of)
            .onErrorResume(ex -> {
              log.warn("[monitor] business validation failed while completing session={}: {}",
                  sessionId, ex.toString());
              return Mono.just(Optional.empty());
            });

    return business
        .map(quality -> finish(session, quality.orElse(null)))
        .flatMap(report -> store.saveSession(report)
            .then(Mono.fromCallable(() -> {
              contextTracker.release(sessionId);
              activeSessions.remove(sessionId, session);
              log.info("[monitor] session completed id={} status={} duration={}s",
                  sessionId, report.status(), report.durationSeconds());
              return Outcome.ok(report);
            }))
            .onErrorResume(ex -> {
              log.error("[monitor] final record not persisted for session={}", sessionId, ex);
              return Mono.just(Outcome.<SessionReport>failure(FailureReason.INTERNAL_ERROR,
                  "Final record of session " + sessionId + " could not be persisted"));
            }))
        .onErrorResume(ex -> internalError("completeSession", sessionId, ex));
  }

  public Mono<Outcome<SystemHealth>> getSystemHealth() {
    return Mono.defer(() -> healthAggregator.aggregate(activeSessions.size()))
        .map(Outcome::ok)
        .onErrorResume(ex -> internalError("getSystemHealth", null, ex));
  }

  /** Live report of an active session, otherwise the persisted final record. */
  public Mono<Outcome<SessionReport>> getSessionReport(String sessionId) {
    MonitoringSession session = sessionId == null ? null : activeSessions.get(sessionId);
    if (session != null) {
      return Mono.fromCallable(() -> Outcome.ok(liveReport(session)))
          .onErrorResume(ex -> internalError("getSessionReport", sessionId, ex));
    }
    if (sessionId == null) {
      return Mono.just(notFound(null));
    }
    return store.findSession(sessionId)
        .map(Outcome::ok)
        .defaultIfEmpty(notFound(sessionId))
        .onErrorResume(ex -> internalError("getSessionReport", sessionId, ex));
  }

  public int activeSessionCount() {
    return activeSessions.size();
  }

  // ------------------------------------------------------------------------
  // stage validation
  // ------------------------------------------------------------------------

  private Mono<StageCheck> runValidator(String stageId, Map<String, Object> input, Map<String, Object> output,
      Map<String, Object> sessionContext) {
    Optional<StageValidator> validator = validators.find(stageId);
    if (validator.isEmpty()) {
      log.warn("[monitor] no validator registered for stage={}", stageId);
      return Mono.just(StageCheck.builder()
          .passed(true)
          .severity(Severity.WARNING)
          .issueType(NO_VALIDATOR)
          .description("No validator registered for stage '" + stageId + "'")
          .build());
    }
    return Mono.defer(() -> validator.get().validate(input, output, sessionContext))
        .subscribeOn(Schedulers.boundedElastic())
        .switchIfEmpty(Mono.fromSupplier(() -> crashed(stageId, "returned no verdict")))
        .onErrorResume(ex -> {
          log.error("[monitor] validator for stage={} threw", stageId, ex);
          return Mono.just(crashed(stageId, "threw " + ex));
        });
  }

  private StageCheck crashed(String stageId, String what) {
    return StageCheck.fail(Severity.ERROR, VALIDATOR_ERROR, "Validator for stage '" + stageId + "' " + what)
        .userImpact("Stage output could not be verified")
        .autoFixable(true)
        .autoFixType(VALIDATOR_ERROR)
        .build();
  }

  private Mono<Optional<AutoFixResult>> autoFix(String stageId, StageCheck check, Map<String, Object> context) {
    if (check.passed() || !check.autoFixable()) {
      return Mono.just(Optional.empty());
    }
    AutoFixer fixer = VALIDATOR_ERROR.equals(check.issueType())
        ? genericAutoFixer
        : validators.autoFixer(stageId).orElse(genericAutoFixer);
    return Mono.defer(() -> fixer.autoFix(check, context))
        .subscribeOn(Schedulers.boundedElastic())
        .map(Optional::of)
        .defaultIfEmpty(Optional.empty())
        .onErrorResume(ex -> {
          log.warn("[monitor] auto-fix failed for stage={}: {}", stageId, ex.toString());
          return Mono.just(Optional.empty());
        });
  }

  private StageResult record(MonitoringSession session, String stageId, StageCheck check,
      Optional<AutoFixResult> fix, Optional<ContextUpdate> update, long durationMs, long validationMs) {
    Instant now = clock.instant();
    boolean fixed = fix.map(AutoFixResult::fixed).orElse(false);

    if (!check.passed()) {
      session.addIssue(Issue.builder()
          .stageId(stageId)
          .type(check.issueType())
          .severity(check.severity())
          .description(check.description())
          .userImpact(check.userImpact())
          .fixed(fixed)
          .detectedAt(now)
          .build());
    }
    fix.filter(AutoFixResult::fixed).ifPresent(f -> {
      session.addAutoFix(new AutoFixRecord(stageId, f.fixType(), f.retryNeeded(), f.detail(), now));
      log.info("[monitor] auto-fix session={} stage={} fix={} retry={}",
          session.getId(), stageId, f.fixType(), f.retryNeeded());
    });

    Map<String, Object> actual = new LinkedHashMap<>(check.actual());
    update.filter(u -> !u.preserved()).ifPresent(u -> actual.put("dataLoss",
        u.dataLoss().stream().map(DataLossEvent::field).collect(Collectors.toList())));

    StageResult result = session.append(StageResult.builder()
        .stageId(stageId)
        .passed(check.passed())
        .severity(check.severity())
        .issueType(check.issueType())
        .description(check.description())
        .expected(check.expected())
        .actual(actual)
        .durationMs(durationMs)
        .validationMs(validationMs)
        .autoFixed(fixed)
        .recordedAt(now)
        .build());

    if (result.isCriticalFailure()) {
      log.warn("[monitor] critical failure session={} stage={} type={}: {}",
          session.getId(), stageId, result.issueType(), result.description());
    } else {
      log.debug("[monitor] stage validated session={} stage={} passed={} severity={}",
          session.getId(), stageId, result.passed(), result.severity());
    }
    return result;
  }

  private void persistAsync(StageResult result) {
    store.saveStageResult(result)
        .subscribeOn(Schedulers.boundedElastic())
        .doOnError(ex -> log.warn("[monitor] stage result not persisted session={} stage={}: {}",
            result.sessionId(), result.stageId(), ex.toString()))
        .onErrorResume(ex -> Mono.empty())
        .subscribe();
  }

  // ------------------------------------------------------------------------
  // business validation and completion
  // ------------------------------------------------------------------------

  private Mono<QualityReport> runBusinessValidation(MonitoringSession session) {
    Map<String, Object> context = contextTracker.currentContext(session.getId()).toOptional().orElse(Map.of());
    return qualityValidator.validate(qualityInput(session, context))
        .map(report -> {
          session.applyBusinessValidation(report);
          if (report.hasCriticalIssues()) {
            log.warn("[monitor] business validation failed session={} critical={}",
                session.getId(), report.criticalIssues().size());
            alertAsync(session.getId(), report);
          } else {
            log.info("[monitor] business validation session={} valid={} warnings={}",
                session.getId(), report.overallValid(), report.warnings().size());
          }
          return report;
        });
  }

  QualityInput qualityInput(MonitoringSession session, Map<String, Object> context) {
    List<StageResult> results = session.getStageResults();
    Map<String, Object> knowledge = PayloadUtils.asMap(context.get(pipeline.contextKey(KNOWLEDGE_STAGE)));
    Map<String, Object> generated = PayloadUtils.asMap(context.get(pipeline.contextKey(GENERATION_STAGE)));
    return QualityInput.builder()
        .sessionId(session.getId())
        .request(PayloadUtils.text(context, "userQuestion", "question"))
        .serviceType(PayloadUtils.text(context, "serviceType"))
        .profile(PayloadUtils.asMap(context.get("birthDetails")))
        .knowledgeText(PayloadUtils.text(knowledge, "knowledge", "retrievedText", "text"))
        .generatedText(PayloadUtils.text(generated, "content", "response", "guidance", "text"))
        .stageResults(results)
        .totalDurationMs(results.stream().mapToLong(StageResult::durationMs).sum())
        .build();
  }

  private void alertAsync(String sessionId, QualityReport report) {
    Mono.fromRunnable(() -> alertSink.notifyCritical(sessionId, report))
        .subscribeOn(Schedulers.boundedElastic())
        .subscribe(null, ex -> log.warn("[monitor] alert delivery failed session={}: {}", sessionId, ex.toString()));
  }

  private SessionReport finish(MonitoringSession session, QualityReport quality) {
    SessionMetrics metrics = metrics(session.getStageResults());
    session.complete(clock.instant(), metrics);
    return report(session, recommendations(session, metrics, quality));
  }

  static SessionMetrics metrics(List<StageResult> results) {
    Map<String, Long> stageDurations = new LinkedHashMap<>();
    long total = 0;
    int passed = 0;
    for (StageResult result : results) {
      stageDurations.merge(result.stageId(), result.durationMs(), Long::sum);
      total += result.durationMs();
      if (result.passed()) {
        passed++;
      }
    }
    double quality = results.isEmpty() ? 0.0 : Math.round(passed * 10000.0 / results.size()) / 100.0;
    return new SessionMetrics(total, stageDurations, performanceScore(total), quality);
  }

  static int performanceScore(long totalMs) {
    if (totalMs < 5_000) {
      return 100;
    }
    if (totalMs < 10_000) {
      return 80;
    }
    if (totalMs < 15_000) {
      return 60;
    }
    return 40;
  }

  private List<String> recommendations(MonitoringSession session, SessionMetrics metrics, QualityReport quality) {
    Set<String> out = new LinkedHashSet<>();
    long slowMs = props.getSlowStageThreshold().toMillis();
    metrics.stageDurations().entrySet().stream()
        .filter(e -> e.getValue() > slowMs)
        .forEach(e -> out.add("Optimize " + e.getKey() + " stage, took " + e.getValue() + "ms"));
    for (Issue issue : session.getIssues()) {
      if (issue.severity() != null && issue.severity().atLeast(Severity.ERROR) && !issue.fixed()) {
        out.add("Fix " + issue.stageId() + ": " + issue.description());
      }
    }
    if (quality != null) {
      out.addAll(quality.recommendations());
    }
    return new ArrayList<>(out);
  }

  private SessionReport liveReport(MonitoringSession session) {
    return report(session, session.getQualityReport() == null
        ? List.of()
        : session.getQualityReport().recommendations());
  }

  private SessionReport report(MonitoringSession session, List<String> recommendations) {
    Optional<IntegrityReport> integrity = contextTracker.validateIntegrity(session.getId()).toOptional();
    return SessionReport.builder()
        .sessionId(session.getId())
        .ownerId(session.getOwnerId())
        .status(session.getStatus())
        .phase(session.getPhase())
        .startedAt(session.getStartedAt())
        .completedAt(session.getCompletedAt())
        .durationSeconds(session.durationSeconds(clock.instant()))
        .stageResults(session.getStageResults())
        .issues(session.getIssues())
        .autoFixes(session.getAutoFixes())
        .anomalies(session.getAnomalies())
        .dataLossDetected(integrity.map(IntegrityReport::dataLossDetected).orElse(false))
        .integrityScore(integrity.map(IntegrityReport::score).orElse(100.0))
        .metrics(session.getMetrics())
        .qualityReport(session.getQualityReport())
        .flow(contextTracker.flowReport(session.getId()).toOptional().orElse(null))
        .recommendations(recommendations)
        .build();
  }

  private static <T> Outcome<T> notFound(String sessionId) {
    return Outcome.failure(FailureReason.SESSION_NOT_FOUND, "No active session " + sessionId);
  }

  private static <T> Mono<Outcome<T>> internalError(String operation, String sessionId, Throwable ex) {
    log.error("[monitor] {} failed for session={}", operation, sessionId, ex);
    return Mono.just(Outcome.failure(FailureReason.INTERNAL_ERROR, operation + " failed"));
  }
}
