package com.example.contentops.flowguard.health;

import com.example.contentops.flowguard.config.MonitorProperties;
import com.example.contentops.flowguard.model.Outcome;
import com.example.contentops.flowguard.service.PipelineMonitor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Periodically recomputes system health and logs the tier. Disable with
 * {@code flowguard.health.enabled=false}.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "flowguard.health", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HealthMonitorJob implements SmartLifecycle {

    private final PipelineMonitor monitor;
    private final MonitorProperties.Health settings;
    private volatile Disposable subscription;

    public HealthMonitorJob(PipelineMonitor monitor, MonitorProperties props) {
        this.monitor = monitor;
        this.settings = props.getHealth();
    }

    @Override
    public synchronized void start() {
        if (isRunning()) {
            return;
        }
        subscription = Flux.interval(settings.getInitialDelay(), settings.getInterval())
                .concatMap(tick -> runOnce())
                .subscribe();
        log.info("[health] periodic check every {} (first in {})", settings.getInterval(), settings.getInitialDelay());
    }

    /** One health pass; never errors. */
    Mono<Outcome<SystemHealth>> runOnce() {
        return monitor.getSystemHealth()
                .doOnNext(this::report)
                .onErrorResume(ex -> {
                    log.warn("[health] periodic check failed: {}", ex.toString());
                    return Mono.empty();
                });
    }

    private void report(Outcome<SystemHealth> outcome) {
        if (!outcome.success()) {
            log.warn("[health] periodic check failed: {}", outcome.error());
            return;
        }
        SystemHealth health = outcome.value();
        if (health.tier() == HealthTier.HEALTHY) {
            log.info("[health] tier={} activeSessions={}", health.tier(), health.activeSessions());
        } else {
            log.warn("[health] tier={} activeSessions={} stages={}", health.tier(), health.activeSessions(),
                    health.stages().values().stream()
                            .filter(r -> r.status() != StageHealthStatus.HEALTHY && r.status() != StageHealthStatus.IDLE)
                            .map(r -> r.stageId() + "=" + r.successRate() + "%")
                            .toList());
        }
    }

    @Override
    public synchronized void stop() {
        if (subscription != null) {
            subscription.dispose();
            subscription = null;
            log.info("[health] periodic check stopped");
        }
    }

    @Override
    public boolean isRunning() {
        Disposable current = subscription;
        return current != null && !current.isDisposed();
    }
}
