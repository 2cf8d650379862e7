package com.example.contentops.flowguard.context;

public record ContextGrowth(long initialSizeBytes, long finalSizeBytes, double growthPercentage, boolean sizeHealthy) {
}
