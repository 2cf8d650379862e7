package com.example.contentops.flowguard.health;

import com.example.contentops.flowguard.config.MonitorProperties;
import com.example.contentops.flowguard.context.PipelineDefinition;
import com.example.contentops.flowguard.dao.MonitoringStore;
import com.example.contentops.flowguard.model.StageResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only rollups of persisted stage results. Never touches live sessions.
 */
@Slf4j
@Service
public class HealthAggregator {

    private final MonitoringStore store;
    private final PipelineDefinition pipeline;
    private final MonitorProperties.Health settings;
    private final Clock clock;

    public HealthAggregator(MonitoringStore store, PipelineDefinition pipeline, MonitorProperties props, Clock clock) {
        this.store = store;
        this.pipeline = pipeline;
        this.settings = props.getHealth();
        this.clock = clock;
    }

    public Mono<SystemHealth> aggregate(int activeSessions) {
        List<String> stageIds = pipeline.stageIds();
        Mono<Map<String, HealthRecord>> primary = rollup(stageIds, settings.getPrimaryWindow());
        Mono<Map<String, HealthRecord>> trend = rollup(stageIds, settings.getTrendWindow());
        Mono<List<StageResult>> failures = Flux.fromIterable(stageIds)
                .concatMap(stageId -> store.loadRecentResults(stageId, settings.getTrendWindow()))
                .filter(result -> !result.passed())
                .sort(Comparator.comparing(StageResult::recordedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
                        .reversed())
                .take(settings.getRecentFailureLimit())
                .collectList();
        return Mono.zip(primary, trend, failures).map(t -> {
            SystemHealth health = new SystemHealth(tierOf(t.getT1().values()), activeSessions,
                    t.getT1(), t.getT2(), t.getT3(), clock.instant());
            log.debug("[health] tier={} active={} stages={}", health.tier(), activeSessions, t.getT1().keySet());
            return health;
        });
    }

    private Mono<Map<String, HealthRecord>> rollup(List<String> stageIds, Duration window) {
        return Flux.fromIterable(stageIds)
                .concatMap(stageId -> store.loadRecentResults(stageId, window)
                        .collectList()
                        .map(results -> record(stageId, window, results)))
                .collect(LinkedHashMap<String, HealthRecord>::new, (map, r) -> map.put(r.stageId(), r))
                .map(map -> (Map<String, HealthRecord>) map);
    }

    HealthRecord record(String stageId, Duration window, List<StageResult> results) {
        int total = results.size();
        if (total == 0) {
            return new HealthRecord(stageId, window, 0, 0, 100.0, 0.0, StageHealthStatus.IDLE);
        }
        int successes = 0;
        long latency = 0;
        for (StageResult result : results) {
            if (result.passed()) {
                successes++;
            }
            latency += result.durationMs();
        }
        double successRate = round2(successes * 100.0 / total);
        StageHealthStatus status;
        if (successRate < settings.getErrorSuccessRate()) {
            status = StageHealthStatus.ERROR;
        } else if (successes < total) {
            status = StageHealthStatus.WARNING;
        } else {
            status = StageHealthStatus.HEALTHY;
        }
        return new HealthRecord(stageId, window, total, successes, successRate, round2((double) latency / total),
                status);
    }

    static HealthTier tierOf(Collection<HealthRecord> records) {
        long errors = records.stream().filter(r -> r.status() == StageHealthStatus.ERROR).count();
        if (errors >= 2) {
            return HealthTier.CRITICAL;
        }
        if (errors == 1) {
            return HealthTier.DEGRADED;
        }
        boolean warnings = records.stream().anyMatch(r -> r.status() == StageHealthStatus.WARNING);
        return warnings ? HealthTier.WARNING : HealthTier.HEALTHY;
    }

    private static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
