package com.example.contentops.flowguard.alert;

import com.example.contentops.flowguard.model.QualityFinding;
import com.example.contentops.flowguard.model.QualityReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/** Default sink: writes critical alerts to the application log. */
@Slf4j
@Component
public class LoggingAlertSink implements AlertSink {

    @Override
    public void notifyCritical(String sessionId, QualityReport details) {
        String issues = details.criticalIssues().stream()
                .map(QualityFinding::description)
                .collect(Collectors.joining("; "));
        log.error("[alert] critical issues in session={}: {}", sessionId, issues);
    }
}
