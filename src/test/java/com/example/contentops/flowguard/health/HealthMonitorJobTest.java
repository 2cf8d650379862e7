package com.example.contentops.flowguard.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.contentops.flowguard.config.MonitorProperties;
import com.example.contentops.flowguard.model.FailureReason;
import com.example.contentops.flowguard.model.Outcome;
import com.example.contentops.flowguard.service.PipelineMonitor;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class HealthMonitorJobTest {

  @Test
  void runOncePassesTheRollupThrough() {
    PipelineMonitor monitor = mock(PipelineMonitor.class);
    HealthRecord generate = new HealthRecord("generate", Duration.ofHours(1), 10, 7, 70.0, 900.0,
        StageHealthStatus.ERROR);
    SystemHealth health = new SystemHealth(HealthTier.DEGRADED, 1, Map.of("generate", generate), Map.of(),
        List.of(), Instant.parse("2024-05-01T10:00:00Z"));
    when(monitor.getSystemHealth()).thenReturn(Mono.just(Outcome.ok(health)));

    Outcome<SystemHealth> outcome = new HealthMonitorJob(monitor, new MonitorProperties()).runOnce().block();

    assertThat(outcome.value().tier()).isEqualTo(HealthTier.DEGRADED);
  }

  @Test
  void runOnceNeverErrors() {
    PipelineMonitor monitor = mock(PipelineMonitor.class);
    when(monitor.getSystemHealth())
        .thenReturn(Mono.just(Outcome.failure(FailureReason.INTERNAL_ERROR, "store offline")))
        .thenReturn(Mono.error(new IllegalStateException("boom")));
    HealthMonitorJob job = new HealthMonitorJob(monitor, new MonitorProperties());

    StepVerifier.create(job.runOnce())
        .assertNext(outcome -> assertThat(outcome.success()).isFalse())
        .verifyComplete();
    StepVerifier.create(job.runOnce()).verifyComplete();
  }

  @Test
  void stopDisposesTheSchedule() {
    MonitorProperties props = new MonitorProperties();
    props.getHealth().setInitialDelay(Duration.ofHours(1));
    HealthMonitorJob job = new HealthMonitorJob(mock(PipelineMonitor.class), props);

    job.start();
    assertThat(job.isRunning()).isTrue();
    job.stop();

    assertThat(job.isRunning()).isFalse();
  }
}
