package com.example.contentops.flowguard.context;

import java.util.List;

public record FlowReport(String sessionId, List<FlowStep> steps, ContextGrowth growth) {
}
