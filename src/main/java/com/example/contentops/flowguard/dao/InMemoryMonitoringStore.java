package com.example.contentops.flowguard.dao;

import com.example.contentops.flowguard.model.SessionReport;
import com.example.contentops.flowguard.model.StageResult;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default store. Keeps the newest {@code maxResultsPerStage} results per stage and at most
 * {@code maxSessions} final session records.
 */
public class InMemoryMonitoringStore implements MonitoringStore {

    private final Map<String, Deque<StageResult>> resultsByStage = new ConcurrentHashMap<>();
    private final Cache<String, SessionReport> sessions;
    private final int maxResultsPerStage;
    private final Clock clock;

    public InMemoryMonitoringStore(int maxResultsPerStage, int maxSessions, Clock clock) {
        this.maxResultsPerStage = maxResultsPerStage;
        this.clock = clock;
        this.sessions = Caffeine.newBuilder()
                .maximumSize(maxSessions)
                .executor(Runnable::run)
                .build();
    }

    @Override
    public Mono<Void> saveStageResult(StageResult result) {
        return Mono.fromRunnable(() -> {
            Deque<StageResult> results = resultsByStage.computeIfAbsent(result.stageId(), k -> new ArrayDeque<>());
            synchronized (results) {
                results.addLast(result);
                while (results.size() > maxResultsPerStage) {
                    results.removeFirst();
                }
            }
        });
    }

    @Override
    public Mono<Void> saveSession(SessionReport report) {
        return Mono.fromRunnable(() -> sessions.put(report.sessionId(), report));
    }

    @Override
    public Flux<StageResult> loadRecentResults(String stageId, Duration window) {
        return Flux.defer(() -> {
            Deque<StageResult> results = resultsByStage.get(stageId);
            if (results == null) {
                return Flux.empty();
            }
            Instant cutoff = clock.instant().minus(window);
            List<StageResult> recent = new ArrayList<>();
            synchronized (results) {
                for (StageResult result : results) {
                    if (result.recordedAt() != null && !result.recordedAt().isBefore(cutoff)) {
                        recent.add(result);
                    }
                }
            }
            return Flux.fromIterable(recent);
        });
    }

    @Override
    public Mono<SessionReport> findSession(String sessionId) {
        return Mono.fromSupplier(() -> sessions.getIfPresent(sessionId));
    }

    long sessionCount() {
        sessions.cleanUp();
        return sessions.estimatedSize();
    }
}
