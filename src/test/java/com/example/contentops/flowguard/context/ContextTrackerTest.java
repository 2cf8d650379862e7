package com.example.contentops.flowguard.context;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.contentops.flowguard.MutableClock;
import com.example.contentops.flowguard.config.MonitorProperties;
import com.example.contentops.flowguard.model.DataLossEvent;
import com.example.contentops.flowguard.model.FailureReason;
import com.example.contentops.flowguard.model.Outcome;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ContextTrackerTest {

  private ContextTracker tracker;

  @BeforeEach
  void setUp() {
    tracker = new ContextTracker(PipelineDefinition.defaults(), new MonitorProperties(),
        new ObjectMapper().findAndRegisterModules(), MutableClock.at("2024-05-01T10:00:00Z"));
  }

  @Test
  void initializeTakesTheFirstSnapshot() {
    Outcome<ContextSnapshot> outcome = tracker.initialize("s-1", initialContext());

    assertThat(outcome.success()).isTrue();
    assertThat(outcome.value().stageId()).isEqualTo("initial");
    assertThat(outcome.value().contentHash()).hasSize(32);
    assertThat(outcome.value().sizeBytes()).isPositive();
    assertThat(tracker.activeCount()).isEqualTo(1);
  }

  @Test
  void initializeTwiceIsRejected() {
    tracker.initialize("s-1", initialContext());

    Outcome<ContextSnapshot> second = tracker.initialize("s-1", Map.of("userQuestion", "other"));

    assertThat(second.success()).isFalse();
    assertThat(second.reason()).isEqualTo(FailureReason.ALREADY_INITIALIZED);
    assertThat(tracker.currentContext("s-1").value()).containsEntry("userQuestion", "What does my career hold?");
  }

  @Test
  void blankSessionIdIsInvalid() {
    assertThat(tracker.initialize(" ", initialContext()).reason()).isEqualTo(FailureReason.INVALID_INPUT);
  }

  @Test
  void updateOfUnknownSessionIsNotFound() {
    Outcome<ContextUpdate> outcome = tracker.update("missing", "fetch", Map.of(), Map.of("rasi", "mesha"));

    assertThat(outcome.success()).isFalse();
    assertThat(outcome.reason()).isEqualTo(FailureReason.SESSION_NOT_FOUND);
  }

  @Test
  void fullHandOverPreservesContext() {
    tracker.initialize("s-1", initialContext());

    ContextUpdate fetch = tracker.update("s-1", "fetch", initialContext(), fetchOutput()).value();
    ContextUpdate knowledge = tracker.update("s-1", "knowledge", Map.of(), Map.of("knowledge", "Saturn text")).value();

    assertThat(fetch.preserved()).isTrue();
    assertThat(knowledge.preserved()).isTrue();
    IntegrityReport integrity = tracker.validateIntegrity("s-1").value();
    assertThat(integrity.score()).isEqualTo(100.0);
    assertThat(integrity.dataLossDetected()).isFalse();
    assertThat(integrity.newFields()).contains("fetchData", "knowledgeData");
    assertThat(tracker.currentContext("s-1").value()).containsKey("knowledgeData");
  }

  @Test
  void droppedQuestionIsRecordedAsDataLoss() {
    tracker.initialize("s-1", initialContext());
    tracker.update("s-1", "fetch", initialContext(), fetchOutput());
    tracker.update("s-1", "knowledge", Map.of(), Map.of("knowledge", "Saturn governs discipline."));

    Map<String, Object> generateOutput = new LinkedHashMap<>();
    generateOutput.put("content", "Guidance");
    generateOutput.put("userQuestion", null);
    ContextUpdate update = tracker.update("s-1", "generate", tracker.currentContext("s-1").value(), generateOutput)
        .value();

    assertThat(update.preserved()).isFalse();
    assertThat(update.dataLoss()).extracting(DataLossEvent::field).containsExactly("userQuestion");
    assertThat(update.dataLoss().get(0).lastKnownValue()).isEqualTo("What does my career hold?");
    assertThat(update.dataLoss().get(0).stageId()).isEqualTo("generate");
    assertThat(tracker.currentContext("s-1").value()).doesNotContainKey("userQuestion");

    IntegrityReport integrity = tracker.validateIntegrity("s-1").value();
    assertThat(integrity.score()).isLessThan(100.0).isEqualTo(80.0);
    assertThat(integrity.missingFields()).containsExactly("userQuestion");
    assertThat(integrity.dataLossDetected()).isTrue();
  }

  @Test
  void partialStageInputIsNotDataLoss() {
    tracker.initialize("s-1", initialContext());

    ContextUpdate fetch = tracker.update("s-1", "fetch",
        Map.of("birthDetails", initialContext().get("birthDetails")), fetchOutput()).value();
    ContextUpdate knowledge = tracker.update("s-1", "knowledge",
        Map.of("rasi", "mesha"), Map.of("knowledge", "Saturn text")).value();

    assertThat(fetch.preserved()).isTrue();
    assertThat(fetch.dataLoss()).isEmpty();
    assertThat(knowledge.preserved()).isTrue();
    IntegrityReport integrity = tracker.validateIntegrity("s-1").value();
    assertThat(integrity.score()).isEqualTo(100.0);
    assertThat(integrity.dataLossDetected()).isFalse();
  }

  @Test
  void fieldCarriedInsideTheOutputIsPreservedAfterADrop() {
    tracker.initialize("s-1", initialContext());

    Map<String, Object> fetch = new LinkedHashMap<>(fetchOutput());
    fetch.put("userQuestion", null);
    fetch.put("request", Map.of("userQuestion", "What does my career hold?"));
    ContextUpdate update = tracker.update("s-1", "fetch", Map.of(), fetch).value();

    assertThat(update.preserved()).isTrue();
    assertThat(tracker.validateIntegrity("s-1").value().score()).isEqualTo(100.0);
  }

  @Test
  void lostFieldRecoversWhenCarriedAgainButTheFlagSticks() {
    tracker.initialize("s-1", initialContext());
    tracker.update("s-1", "fetch", initialContext(), fetchOutput());
    Map<String, Object> knowledgeOutput = new LinkedHashMap<>();
    knowledgeOutput.put("knowledge", "text");
    knowledgeOutput.put("userQuestion", null);
    tracker.update("s-1", "knowledge", Map.of(), knowledgeOutput);

    ContextUpdate generate = tracker.update("s-1", "generate", Map.of(),
        Map.of("content", "Guidance", "userQuestion", "What does my career hold?")).value();

    assertThat(generate.preserved()).isTrue();
    assertThat(tracker.currentContext("s-1").value()).containsEntry("userQuestion", "What does my career hold?");
    IntegrityReport integrity = tracker.validateIntegrity("s-1").value();
    assertThat(integrity.score()).isEqualTo(100.0);
    assertThat(integrity.dataLossDetected()).isTrue();
    assertThat(integrity.dataLossEvents()).hasSize(1);
  }

  @Test
  void fieldsNotYetProducedAreNotLost() {
    tracker.initialize("s-1", initialContext());

    ContextUpdate knowledge = tracker.update("s-1", "knowledge", initialContext(), Map.of("knowledge", "text")).value();

    assertThat(knowledge.preserved()).isTrue();
  }

  @Test
  void binaryPayloadsAreKeptOutOfSnapshots() {
    tracker.initialize("s-1", initialContext());

    tracker.update("s-1", "voice", Map.of(),
        Map.of("audioUrl", "https://cdn/a.mp3", "audioData", new byte[] {1, 2, 3}, "raw", new byte[] {4}));

    List<ContextSnapshot> snapshots = tracker.snapshots("s-1").value();
    Map<String, ?> voice = (Map<String, ?>) snapshots.get(1).data().get("voiceData");
    assertThat(voice).containsOnlyKeys("audioUrl");
    assertThat(snapshots.get(1).data()).doesNotContainKey("audioData");
  }

  @Test
  void flowReportListsAddedKeysPerStage() {
    tracker.initialize("s-1", initialContext());
    tracker.update("s-1", "fetch", initialContext(), fetchOutput());

    FlowReport report = tracker.flowReport("s-1").value();

    assertThat(report.steps()).hasSize(1);
    assertThat(report.steps().get(0).stageId()).isEqualTo("fetch");
    assertThat(report.steps().get(0).addedKeys()).contains("fetchData", "rasi");
    assertThat(report.steps().get(0).removedKeys()).isEmpty();
    assertThat(report.growth().growthPercentage()).isPositive();
    assertThat(report.growth().sizeHealthy()).isTrue();
  }

  @Test
  void snapshotsAreNotAffectedByLaterMutationOfTheOutput() {
    tracker.initialize("s-1", initialContext());
    Map<String, Object> output = new LinkedHashMap<>(fetchOutput());

    tracker.update("s-1", "fetch", initialContext(), output);
    output.put("rasi", "changed");

    Map<?, ?> fetchData = (Map<?, ?>) tracker.snapshots("s-1").value().get(1).data().get("fetchData");
    assertThat(fetchData.get("rasi")).isEqualTo("mesha");
  }

  @Test
  void releaseDropsTheJournal() {
    tracker.initialize("s-1", initialContext());

    assertThat(tracker.release("s-1")).isTrue();
    assertThat(tracker.release("s-1")).isFalse();
    assertThat(tracker.validateIntegrity("s-1").reason()).isEqualTo(FailureReason.SESSION_NOT_FOUND);
  }

  static Map<String, Object> initialContext() {
    Map<String, Object> context = new LinkedHashMap<>();
    context.put("sessionId", "s-1");
    context.put("userId", "u-1");
    context.put("userQuestion", "What does my career hold?");
    context.put("serviceType", "quick_guidance");
    context.put("birthDetails", Map.of("date", "1990-01-01", "time", "06:30", "location", "Chennai"));
    return context;
  }

  static Map<String, Object> fetchOutput() {
    return Map.of("rasi", "mesha", "nakshatra", "ashwini", "planets", List.of(Map.of("name", "sun")));
  }
}
