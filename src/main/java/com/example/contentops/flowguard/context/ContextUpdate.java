package com.example.contentops.flowguard.context;

import com.example.contentops.flowguard.model.DataLossEvent;

import java.util.List;

public record ContextUpdate(boolean preserved, List<DataLossEvent> dataLoss, long contextSize) {

    public ContextUpdate {
        dataLoss = dataLoss == null ? List.of() : List.copyOf(dataLoss);
    }
}
