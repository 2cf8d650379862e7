package com.example.contentops.flowguard.alert;

import com.example.contentops.flowguard.model.QualityReport;

/** Receives critical business-validation alerts. Callers fire and forget. */
public interface AlertSink {

    void notifyCritical(String sessionId, QualityReport details);
}
