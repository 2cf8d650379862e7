package com.example.contentops.flowguard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Binds properties:
 *
 * langchain4j.openai.api-key=...
 * langchain4j.openai.embedding-model=text-embedding-3-small
 * langchain4j.openai.timeout=20s
 */
@Data
@ConfigurationProperties(prefix = "langchain4j.openai")
public class Langchain4jOpenAiProperties {

    /**
     * OpenAI API key. Semantic similarity falls back to a neutral score when absent.
     */
    private String apiKey;

    /**
     * Embedding model name
     */
    private String embeddingModel = "text-embedding-3-small";

    /**
     * Per-request timeout for the embedding endpoint
     */
    private Duration timeout = Duration.ofSeconds(20);
}
