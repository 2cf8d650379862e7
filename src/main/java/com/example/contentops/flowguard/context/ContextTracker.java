package com.example.contentops.flowguard.context;

import com.example.contentops.flowguard.config.MonitorProperties;
import com.example.contentops.flowguard.model.DataLossEvent;
import com.example.contentops.flowguard.model.FailureReason;
import com.example.contentops.flowguard.model.Outcome;
import com.example.contentops.flowguard.util.PayloadUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the accumulating context of every active session and catches critical fields that silently
 * disappear between stages. Every method reports problems through {@link Outcome} and never throws.
 */
@Slf4j
@Component
public class ContextTracker {

    static final String INITIAL_STAGE = "initial";
    private static final long HEALTHY_CONTEXT_BYTES = 1024L * 1024L;

    private final Map<String, ContextJournal> journals = new ConcurrentHashMap<>();
    private final PipelineDefinition pipeline;
    private final Set<String> binaryFields;
    private final ObjectMapper canonicalMapper;
    private final Clock clock;

    public ContextTracker(PipelineDefinition pipeline, MonitorProperties props, ObjectMapper objectMapper, Clock clock) {
        this.pipeline = pipeline;
        this.binaryFields = Set.copyOf(props.getBinaryFields());
        this.canonicalMapper = objectMapper.copy().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
        this.clock = clock;
    }

    public Outcome<ContextSnapshot> initialize(String sessionId, Map<String, ?> initialContext) {
        if (sessionId == null || sessionId.isBlank()) {
            return Outcome.failure(FailureReason.INVALID_INPUT, "sessionId is required");
        }
        try {
            Map<String, Object> initial = Collections.unmodifiableMap(PayloadUtils.deepCopy(initialContext, binaryFields));
            ContextJournal journal = new ContextJournal(sessionId, initial, PayloadUtils.deepCopy(initial, binaryFields));
            ContextSnapshot snapshot = snapshot(INITIAL_STAGE, journal.current);
            journal.snapshots.add(snapshot);
            if (journals.putIfAbsent(sessionId, journal) != null) {
                return Outcome.failure(FailureReason.ALREADY_INITIALIZED,
                        "Context for session " + sessionId + " is already initialized");
            }
            log.debug("[context] initialized session={} keys={} size={}B",
                    sessionId, initial.keySet(), snapshot.sizeBytes());
            return Outcome.ok(snapshot);
        } catch (RuntimeException ex) {
            log.warn("[context] initialize failed for session={}: {}", sessionId, ex.toString());
            return Outcome.failure(FailureReason.INTERNAL_ERROR, "Context initialization failed");
        }
    }

    /**
     * Checks the critical fields required at {@code stageId}, then merges the stage output into the
     * tracked context.
     *
     * A field counts as preserved while it is a top-level key of the tracked context or appears anywhere
     * in the stage output. A top-level output key mapped to null drops that key from the tracked context.
     *
     * @param stageInput  context the stage was handed, kept for the caller's record only
     * @param stageOutput what the stage produced, stored under the stage's context key
     */
    public Outcome<ContextUpdate> update(String sessionId, String stageId,
                                         Map<String, ?> stageInput, Map<String, ?> stageOutput) {
        ContextJournal journal = journals.get(sessionId);
        if (journal == null) {
            return Outcome.failure(FailureReason.SESSION_NOT_FOUND, "No context for session " + sessionId);
        }
        try {
            synchronized (journal) {
                return Outcome.ok(applyUpdate(journal, stageId, stageInput, stageOutput));
            }
        } catch (RuntimeException ex) {
            log.warn("[context] update failed for session={} stage={}: {}", sessionId, stageId, ex.toString());
            return Outcome.failure(FailureReason.INTERNAL_ERROR, "Context update failed for stage " + stageId);
        }
    }

    private ContextUpdate applyUpdate(ContextJournal journal, String stageId,
                                      Map<String, ?> stageInput, Map<String, ?> stageOutput) {
        Map<String, Object> output = PayloadUtils.deepCopy(stageOutput, binaryFields);
        Instant now = clock.instant();

        Map<String, Object> lastKnown = new HashMap<>();
        List<String> dropped = new ArrayList<>();
        output.forEach((key, value) -> {
            if (value == null) {
                dropped.add(key);
            }
        });
        for (String key : dropped) {
            output.remove(key);
            if (journal.current.containsKey(key)) {
                lastKnown.put(key, journal.current.remove(key));
            }
        }

        List<DataLossEvent> losses = new ArrayList<>();
        for (String field : pipeline.requiredFields(stageId)) {
            boolean introduced = journal.lostFields.contains(field)
                    || lastKnown.containsKey(field)
                    || PayloadUtils.containsKeyDeep(journal.current, field);
            if (!introduced) {
                continue;
            }
            if (journal.current.containsKey(field) || PayloadUtils.containsKeyDeep(output, field)) {
                journal.lostFields.remove(field);
                continue;
            }
            Object value = lastKnown.containsKey(field)
                    ? lastKnown.get(field)
                    : PayloadUtils.findDeep(journal.current, field);
            DataLossEvent event = new DataLossEvent(field, value, stageId, now);
            losses.add(event);
            journal.dataLossEvents.add(event);
            journal.lostFields.add(field);
            log.warn("[context] data loss session={} stage={} field={}", journal.sessionId, stageId, field);
        }
        if (!losses.isEmpty()) {
            journal.dataLossDetected = true;
        }

        journal.current.put(pipeline.contextKey(stageId), output);
        output.forEach(journal.current::putIfAbsent);

        ContextSnapshot previous = journal.lastSnapshot();
        ContextSnapshot next = snapshot(stageId, journal.current);
        journal.snapshots.add(next);
        journal.steps.add(diff(stageId, previous, next));
        return new ContextUpdate(losses.isEmpty(), losses, next.sizeBytes());
    }

    public Outcome<IntegrityReport> validateIntegrity(String sessionId) {
        ContextJournal journal = journals.get(sessionId);
        if (journal == null) {
            return Outcome.failure(FailureReason.SESSION_NOT_FOUND, "No context for session " + sessionId);
        }
        try {
            synchronized (journal) {
                List<String> tracked = new ArrayList<>();
                for (String field : pipeline.criticalFields()) {
                    if (PayloadUtils.containsKeyDeep(journal.initial, field)) {
                        tracked.add(field);
                    }
                }
                List<String> missing = new ArrayList<>();
                for (String field : tracked) {
                    if (journal.lostFields.contains(field) || !PayloadUtils.containsKeyDeep(journal.current, field)) {
                        missing.add(field);
                    }
                }
                double score = tracked.isEmpty()
                        ? 100.0
                        : round2((tracked.size() - missing.size()) * 100.0 / tracked.size());
                List<String> newFields = new ArrayList<>();
                for (String key : journal.current.keySet()) {
                    if (!journal.initial.containsKey(key)) {
                        newFields.add(key);
                    }
                }
                return Outcome.ok(new IntegrityReport(score, List.copyOf(missing), newFields.size(),
                        List.copyOf(newFields), List.copyOf(journal.dataLossEvents), journal.dataLossDetected));
            }
        } catch (RuntimeException ex) {
            log.warn("[context] integrity check failed for session={}: {}", sessionId, ex.toString());
            return Outcome.failure(FailureReason.INTERNAL_ERROR, "Integrity check failed");
        }
    }

    public Outcome<FlowReport> flowReport(String sessionId) {
        ContextJournal journal = journals.get(sessionId);
        if (journal == null) {
            return Outcome.failure(FailureReason.SESSION_NOT_FOUND, "No context for session " + sessionId);
        }
        try {
            synchronized (journal) {
                long initialSize = journal.snapshots.get(0).sizeBytes();
                long finalSize = journal.lastSnapshot().sizeBytes();
                double growth = initialSize == 0 ? 0.0 : round2((finalSize - initialSize) * 100.0 / initialSize);
                ContextGrowth contextGrowth = new ContextGrowth(initialSize, finalSize, growth,
                        finalSize < HEALTHY_CONTEXT_BYTES);
                return Outcome.ok(new FlowReport(sessionId, List.copyOf(journal.steps), contextGrowth));
            }
        } catch (RuntimeException ex) {
            log.warn("[context] flow report failed for session={}: {}", sessionId, ex.toString());
            return Outcome.failure(FailureReason.INTERNAL_ERROR, "Flow report failed");
        }
    }

    /** Read-only deep copy of the tracked context. */
    public Outcome<Map<String, Object>> currentContext(String sessionId) {
        ContextJournal journal = journals.get(sessionId);
        if (journal == null) {
            return Outcome.failure(FailureReason.SESSION_NOT_FOUND, "No context for session " + sessionId);
        }
        synchronized (journal) {
            return Outcome.ok(PayloadUtils.immutableCopy(journal.current));
        }
    }

    public Outcome<List<ContextSnapshot>> snapshots(String sessionId) {
        ContextJournal journal = journals.get(sessionId);
        if (journal == null) {
            return Outcome.failure(FailureReason.SESSION_NOT_FOUND, "No context for session " + sessionId);
        }
        synchronized (journal) {
            return Outcome.ok(List.copyOf(journal.snapshots));
        }
    }

    /** Drops the journal so the id can be initialized again. */
    public boolean release(String sessionId) {
        return journals.remove(sessionId) != null;
    }

    public int activeCount() {
        return journals.size();
    }

    private ContextSnapshot snapshot(String stageId, Map<String, Object> context) {
        Map<String, Object> data = Collections.unmodifiableMap(PayloadUtils.deepCopy(context, binaryFields));
        byte[] canonical = canonicalJson(data);
        return new ContextSnapshot(stageId, data, DigestUtils.md5DigestAsHex(canonical), canonical.length,
                clock.instant());
    }

    private byte[] canonicalJson(Map<String, Object> data) {
        try {
            return canonicalMapper.writeValueAsBytes(data);
        } catch (JsonProcessingException ex) {
            log.debug("[context] falling back to toString for hashing: {}", ex.getOriginalMessage());
            return String.valueOf(data).getBytes(StandardCharsets.UTF_8);
        }
    }

    private static FlowStep diff(String stageId, ContextSnapshot before, ContextSnapshot after) {
        List<String> added = new ArrayList<>();
        List<String> modified = new ArrayList<>();
        List<String> removed = new ArrayList<>();
        after.data().forEach((key, value) -> {
            if (!before.data().containsKey(key)) {
                added.add(key);
            } else if (!Objects.equals(before.data().get(key), value)) {
                modified.add(key);
            }
        });
        for (String key : before.data().keySet()) {
            if (!after.data().containsKey(key)) {
                removed.add(key);
            }
        }
        return new FlowStep(stageId, List.copyOf(added), List.copyOf(removed), List.copyOf(modified),
                before.sizeBytes(), after.sizeBytes(), after.takenAt());
    }

    private static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
