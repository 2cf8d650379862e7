package com.example.contentops.flowguard.context;

import com.example.contentops.flowguard.config.MonitorProperties;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Canonical stage order of the monitored pipeline and the cumulative critical-field policy derived
 * from it: each stage requires its own fields plus everything earlier stages required.
 */
public class PipelineDefinition {

    private final List<MonitorProperties.Stage> stages;
    private final Map<String, Integer> positions = new LinkedHashMap<>();
    private final Map<String, Set<String>> requiredFields = new LinkedHashMap<>();
    private final Set<String> criticalFields;

    public PipelineDefinition(List<MonitorProperties.Stage> stages) {
        if (stages == null || stages.isEmpty()) {
            throw new IllegalArgumentException("pipeline must define at least one stage");
        }
        this.stages = List.copyOf(stages);
        Set<String> cumulative = new LinkedHashSet<>();
        for (int i = 0; i < this.stages.size(); i++) {
            MonitorProperties.Stage stage = this.stages.get(i);
            if (positions.putIfAbsent(stage.getId(), i) != null) {
                throw new IllegalArgumentException("duplicate pipeline stage: " + stage.getId());
            }
            if (stage.getRequiredFields() != null) {
                cumulative.addAll(stage.getRequiredFields());
            }
            requiredFields.put(stage.getId(), Collections.unmodifiableSet(new LinkedHashSet<>(cumulative)));
        }
        this.criticalFields = Collections.unmodifiableSet(cumulative);
    }

    public static PipelineDefinition defaults() {
        return new PipelineDefinition(MonitorProperties.defaultPipeline());
    }

    /** Position in the canonical order, or -1 for a stage the pipeline does not define. */
    public int indexOf(String stageId) {
        return positions.getOrDefault(stageId, -1);
    }

    public Optional<MonitorProperties.Stage> stage(String stageId) {
        int index = indexOf(stageId);
        return index < 0 ? Optional.empty() : Optional.of(stages.get(index));
    }

    public String contextKey(String stageId) {
        return stage(stageId)
                .map(MonitorProperties.Stage::getContextKey)
                .filter(key -> !key.isBlank())
                .orElse(stageId);
    }

    /** Cumulative critical fields at {@code stageId}; empty for unknown stages. */
    public Set<String> requiredFields(String stageId) {
        return requiredFields.getOrDefault(stageId, Set.of());
    }

    public Set<String> criticalFields() {
        return criticalFields;
    }

    public List<String> stageIds() {
        return new ArrayList<>(positions.keySet());
    }

    public List<String> requiredStageIds() {
        List<String> ids = new ArrayList<>();
        for (MonitorProperties.Stage stage : stages) {
            if (stage.isRequired()) {
                ids.add(stage.getId());
            }
        }
        return ids;
    }
}
