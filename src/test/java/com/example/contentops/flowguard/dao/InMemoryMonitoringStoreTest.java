package com.example.contentops.flowguard.dao;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.contentops.flowguard.MutableClock;
import com.example.contentops.flowguard.model.SessionReport;
import com.example.contentops.flowguard.model.SessionStatus;
import com.example.contentops.flowguard.model.StageResult;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class InMemoryMonitoringStoreTest {

  private final MutableClock clock = MutableClock.at("2024-05-01T10:00:00Z");

  @Test
  void loadsOnlyResultsInsideTheWindow() {
    InMemoryMonitoringStore store = new InMemoryMonitoringStore(100, 100, clock);
    store.saveStageResult(result("generate", 1, clock.instant().minus(Duration.ofHours(2)))).block();
    store.saveStageResult(result("generate", 2, clock.instant().minus(Duration.ofMinutes(5)))).block();
    store.saveStageResult(result("fetch", 3, clock.instant())).block();

    List<StageResult> recent = store.loadRecentResults("generate", Duration.ofHours(1)).collectList().block();

    assertThat(recent).extracting(StageResult::sequence).containsExactly(2);
    assertThat(store.loadRecentResults("voice", Duration.ofHours(1)).collectList().block()).isEmpty();
  }

  @Test
  void keepsTheNewestResultsPerStage() {
    InMemoryMonitoringStore store = new InMemoryMonitoringStore(2, 100, clock);
    for (int i = 1; i <= 3; i++) {
      store.saveStageResult(result("generate", i, clock.instant())).block();
    }

    List<StageResult> recent = store.loadRecentResults("generate", Duration.ofHours(1)).collectList().block();

    assertThat(recent).extracting(StageResult::sequence).containsExactly(2, 3);
  }

  @Test
  void sessionRecordsAreReplacedById() {
    InMemoryMonitoringStore store = new InMemoryMonitoringStore(10, 100, clock);
    store.saveSession(SessionReport.builder().sessionId("s-1").status(SessionStatus.SUCCESS).build()).block();
    store.saveSession(SessionReport.builder().sessionId("s-1").status(SessionStatus.FAILED).build()).block();

    assertThat(store.findSession("s-1").block().status()).isEqualTo(SessionStatus.FAILED);
    assertThat(store.findSession("s-2").blockOptional()).isEmpty();
  }

  @Test
  void sessionRecordsAreBounded() {
    InMemoryMonitoringStore store = new InMemoryMonitoringStore(10, 50, clock);
    for (int i = 0; i < 2_000; i++) {
      store.saveSession(SessionReport.builder().sessionId("x-" + i).status(SessionStatus.SUCCESS).build()).block();
    }

    long retained = 0;
    for (int i = 0; i < 2_000; i++) {
      if (store.findSession("x-" + i).blockOptional().isPresent()) {
        retained++;
      }
    }
    assertThat(store.sessionCount()).isLessThanOrEqualTo(50);
    assertThat(retained).isLessThanOrEqualTo(50);
  }

  private static StageResult result(String stageId, int sequence, java.time.Instant at) {
    return StageResult.builder().sessionId("s-1").sequence(sequence).stageId(stageId).passed(true).recordedAt(at)
        .build();
  }
}
