package com.example.contentops.flowguard.dao;

import com.example.contentops.flowguard.model.SessionReport;
import com.example.contentops.flowguard.model.StageResult;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/** Persistence of stage results and final session records. */
public interface MonitoringStore {

    Mono<Void> saveStageResult(StageResult result);

    /** Inserts or replaces the record of a session. */
    Mono<Void> saveSession(SessionReport report);

    /** Results of one stage recorded within the trailing {@code window}, oldest first. */
    Flux<StageResult> loadRecentResults(String stageId, Duration window);

    Mono<SessionReport> findSession(String sessionId);
}
