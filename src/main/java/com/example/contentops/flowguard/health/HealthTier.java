package com.example.contentops.flowguard.health;

/** System-wide health, from best to worst. */
public enum HealthTier {
    HEALTHY,
    WARNING,
    DEGRADED,
    CRITICAL
}
