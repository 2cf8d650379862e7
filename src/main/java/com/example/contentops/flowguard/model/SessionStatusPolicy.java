package com.example.contentops.flowguard.model;

import java.util.List;

/** Derives a session status from its stage results. */
public final class SessionStatusPolicy {

    private SessionStatusPolicy() {
    }

    /**
     * Any failed critical result means FAILED. More than {@code partialFailureThreshold} other failures
     * means PARTIAL, at least one means DEGRADED, none means SUCCESS.
     */
    public static SessionStatus derive(List<StageResult> results, int partialFailureThreshold) {
        int failures = 0;
        for (StageResult result : results) {
            if (result.passed()) {
                continue;
            }
            if (result.severity() == Severity.CRITICAL) {
                return SessionStatus.FAILED;
            }
            failures++;
        }
        if (failures > partialFailureThreshold) {
            return SessionStatus.PARTIAL;
        }
        return failures > 0 ? SessionStatus.DEGRADED : SessionStatus.SUCCESS;
    }
}
