package com.example.contentops.flowguard.config;

import com.example.contentops.flowguard.context.PipelineDefinition;
import com.example.contentops.flowguard.dao.InMemoryMonitoringStore;
import com.example.contentops.flowguard.dao.JdbcMonitoringStore;
import com.example.contentops.flowguard.dao.MonitoringStore;
import com.example.contentops.flowguard.quality.QualityLexicon;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.util.Locale;

@Slf4j
@Configuration
public class MonitorConfig {

    @Bean
    public Clock monitorClock() {
        return Clock.systemUTC();
    }

    @Bean
    public PipelineDefinition pipelineDefinition(MonitorProperties props) {
        return new PipelineDefinition(props.getPipeline());
    }

    @Bean
    public QualityLexicon qualityLexicon(ResourceLoader resourceLoader, ObjectMapper objectMapper,
                                         MonitorProperties props) {
        QualityLexicon lexicon = QualityLexicon.load(resourceLoader.getResource(props.getLexiconLocation()), objectMapper);
        log.info("[config] quality lexicon loaded from {}", props.getLexiconLocation());
        return lexicon;
    }

    /**
     * {@code flowguard.store.type=memory} (default) keeps results in process;
     * {@code jdbc} writes them through the auto-configured datasource (see the {@code jdbc} profile).
     */
    @Bean
    public MonitoringStore monitoringStore(MonitorProperties props, ObjectMapper objectMapper, Clock clock,
                                           ObjectProvider<JdbcTemplate> jdbcTemplate) {
        MonitorProperties.Store settings = props.getStore();
        String type = settings.getType().trim().toLowerCase(Locale.ROOT);
        switch (type) {
            case "memory":
                log.info("[config] monitoring store: in-memory, {} results per stage, {} sessions",
                        settings.getMaxResultsPerStage(), settings.getMaxSessions());
                return new InMemoryMonitoringStore(settings.getMaxResultsPerStage(), settings.getMaxSessions(), clock);
            case "jdbc":
                JdbcTemplate template = jdbcTemplate.getIfAvailable();
                if (template == null) {
                    throw new IllegalStateException(
                            "flowguard.store.type=jdbc needs a datasource; activate the jdbc profile or set spring.datasource.*");
                }
                log.info("[config] monitoring store: jdbc");
                return new JdbcMonitoringStore(template, objectMapper, clock);
            default:
                throw new IllegalStateException("Unknown flowguard.store.type: " + settings.getType());
        }
    }
}
