package com.example.contentops.flowguard.model;

/** Derived outcome of a monitored session. */
public enum SessionStatus {
    SUCCESS,
    DEGRADED,
    PARTIAL,
    FAILED
}
