package com.example.contentops.flowguard.dao;

import com.example.contentops.flowguard.model.SessionReport;
import com.example.contentops.flowguard.model.Severity;
import com.example.contentops.flowguard.model.StageResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

/**
 * {@link MonitoringStore} on top of {@link JdbcTemplate}. Expected/actual payloads and final session
 * records are stored as JSON text. Blocking calls are moved to the bounded-elastic scheduler.
 */
@Slf4j
public class JdbcMonitoringStore implements MonitoringStore {

    private static final int MAX_DESCRIPTION = 2000;
    private static final TypeReference<Map<String, Object>> PAYLOAD = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final RowMapper<StageResult> stageResultMapper = (rs, rowNum) -> StageResult.builder()
            .sessionId(rs.getString("session_id"))
            .sequence(rs.getInt("sequence_no"))
            .stageId(rs.getString("stage_id"))
            .passed(rs.getBoolean("passed"))
            .severity(Severity.valueOf(rs.getString("severity")))
            .issueType(rs.getString("issue_type"))
            .description(rs.getString("description"))
            .expected(readPayload(rs.getString("expected_json")))
            .actual(readPayload(rs.getString("actual_json")))
            .durationMs(rs.getLong("duration_ms"))
            .validationMs(rs.getLong("validation_ms"))
            .autoFixed(rs.getBoolean("auto_fixed"))
            .recordedAt(rs.getObject("recorded_at", OffsetDateTime.class).toInstant())
            .build();

    public JdbcMonitoringStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper.copy().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.clock = clock;
    }

    @Override
    public Mono<Void> saveStageResult(StageResult result) {
        final String sql = """
                insert into stage_results (session_id, sequence_no, stage_id, passed, severity, issue_type,
                                           description, expected_json, actual_json, duration_ms, validation_ms,
                                           auto_fixed, recorded_at)
                values (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
        return Mono.fromCallable(() -> jdbcTemplate.update(sql,
                        result.sessionId(),
                        result.sequence(),
                        result.stageId(),
                        result.passed(),
                        result.severity().name(),
                        result.issueType(),
                        truncate(result.description()),
                        writeJson(result.expected()),
                        writeJson(result.actual()),
                        result.durationMs(),
                        result.validationMs(),
                        result.autoFixed(),
                        toOffset(result.recordedAt() != null ? result.recordedAt() : clock.instant())))
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    @Override
    public Mono<Void> saveSession(SessionReport report) {
        final String update = """
                update monitoring_sessions
                   set owner_id = ?, status = ?, started_at = ?, completed_at = ?, report_json = ?
                 where session_id = ?
                """;
        final String insert = """
                insert into monitoring_sessions (session_id, owner_id, status, started_at, completed_at, report_json)
                values (?, ?, ?, ?, ?, ?)
                """;
        return Mono.fromCallable(() -> {
                    String json = writeJson(report);
                    String status = report.status() == null ? null : report.status().name();
                    int updated = jdbcTemplate.update(update, report.ownerId(), status,
                            toOffset(report.startedAt()), toOffset(report.completedAt()), json, report.sessionId());
                    if (updated == 0) {
                        jdbcTemplate.update(insert, report.sessionId(), report.ownerId(), status,
                                toOffset(report.startedAt()), toOffset(report.completedAt()), json);
                    }
                    return updated;
                })
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    @Override
    public Flux<StageResult> loadRecentResults(String stageId, Duration window) {
        final String sql = """
                select session_id, sequence_no, stage_id, passed, severity, issue_type, description,
                       expected_json, actual_json, duration_ms, validation_ms, auto_fixed, recorded_at
                  from stage_results
                 where stage_id = ?
                   and recorded_at >= ?
                 order by recorded_at, id
                """;
        return Mono.fromCallable(() -> jdbcTemplate.query(sql, stageResultMapper, stageId,
                        toOffset(clock.instant().minus(window))))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapMany(Flux::fromIterable);
    }

    @Override
    public Mono<SessionReport> findSession(String sessionId) {
        final String sql = "select report_json from monitoring_sessions where session_id = ?";
        return Mono.fromCallable(() -> {
                    List<String> rows = jdbcTemplate.queryForList(sql, String.class, sessionId);
                    return rows.isEmpty() ? null : objectMapper.readValue(rows.get(0), SessionReport.class);
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private Map<String, Object> readPayload(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, PAYLOAD);
        } catch (JsonProcessingException e) {
            log.warn("[store] unreadable payload, returning empty map: {}", e.getOriginalMessage());
            return Map.of();
        }
    }

    private static String truncate(String description) {
        return description == null || description.length() <= MAX_DESCRIPTION ? description
                : description.substring(0, MAX_DESCRIPTION);
    }

    private static OffsetDateTime toOffset(Instant instant) {
        return instant == null ? null : instant.atOffset(ZoneOffset.UTC);
    }
}
