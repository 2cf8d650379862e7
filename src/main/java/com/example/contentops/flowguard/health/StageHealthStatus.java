package com.example.contentops.flowguard.health;

public enum StageHealthStatus {
    HEALTHY,
    WARNING,
    ERROR,
    /** No samples in the window. Treated as healthy. */
    IDLE
}
