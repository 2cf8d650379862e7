package com.example.contentops.flowguard.model;

/** Lifecycle position of a session inside the monitor. */
public enum SessionPhase {
    STARTED,
    STAGE_VALIDATED,
    BUSINESS_VALIDATED,
    COMPLETED,
    /** Reachable from any phase once a critical issue is recorded. */
    FAILED
}
