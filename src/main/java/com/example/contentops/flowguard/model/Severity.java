package com.example.contentops.flowguard.model;

/** Severity of a stage or business validation finding, ordered from harmless to fatal. */
public enum Severity {
    NONE,
    WARNING,
    ERROR,
    CRITICAL;

    public boolean atLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
