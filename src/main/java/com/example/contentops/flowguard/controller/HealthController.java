package com.example.contentops.flowguard.controller;

import com.example.contentops.flowguard.health.SystemHealth;
import com.example.contentops.flowguard.service.PipelineMonitor;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/health")
public class HealthController {

    private final PipelineMonitor monitor;

    public HealthController(PipelineMonitor monitor) {
        this.monitor = monitor;
    }

    @GetMapping
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return monitor.getSystemHealth().map(outcome -> {
            if (!outcome.success()) {
                return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                        .body(Map.<String, Object>of("status", "unavailable", "error", String.valueOf(outcome.error())));
            }
            SystemHealth health = outcome.value();
            return ResponseEntity.ok(Map.<String, Object>of("status", health.tier(), "health", health));
        });
    }
}
