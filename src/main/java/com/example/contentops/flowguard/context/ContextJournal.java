package com.example.contentops.flowguard.context;

import com.example.contentops.flowguard.model.DataLossEvent;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Per-session context state. Guarded by its own monitor inside {@link ContextTracker}. */
class ContextJournal {

    final String sessionId;
    final Map<String, Object> initial;
    final Map<String, Object> current;
    final List<ContextSnapshot> snapshots = new ArrayList<>();
    final List<FlowStep> steps = new ArrayList<>();
    final List<DataLossEvent> dataLossEvents = new ArrayList<>();
    final Set<String> lostFields = new LinkedHashSet<>();
    boolean dataLossDetected;

    ContextJournal(String sessionId, Map<String, Object> initial, Map<String, Object> current) {
        this.sessionId = sessionId;
        this.initial = initial;
        this.current = new LinkedHashMap<>(current);
    }

    ContextSnapshot lastSnapshot() {
        return snapshots.get(snapshots.size() - 1);
    }
}
