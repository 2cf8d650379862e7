package com.example.contentops.flowguard.config;

import com.example.contentops.flowguard.quality.EmbeddingProvider;
import com.example.contentops.flowguard.quality.LangChain4jEmbeddingProvider;
import com.example.contentops.flowguard.quality.UnavailableEmbeddingProvider;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Embedding model behind the semantic similarity score. A user-supplied {@link EmbeddingModel} bean
 * wins; otherwise OpenAI is used when an API key is configured, and similarity stays neutral when not.
 */
@Slf4j
@Configuration
public class EmbeddingConfig {

    @Bean
    public EmbeddingProvider embeddingProvider(ObjectProvider<EmbeddingModel> embeddingModel,
                                               Langchain4jOpenAiProperties props) {
        EmbeddingModel model = embeddingModel.getIfAvailable();
        if (model != null) {
            log.info("[config] embeddings via {}", model.getClass().getSimpleName());
            return new LangChain4jEmbeddingProvider(model);
        }
        if (StringUtils.hasText(props.getApiKey())) {
            log.info("[config] embeddings via OpenAI model={}", props.getEmbeddingModel());
            return new LangChain4jEmbeddingProvider(OpenAiEmbeddingModel.builder()
                    .apiKey(props.getApiKey())
                    .modelName(props.getEmbeddingModel())
                    .timeout(props.getTimeout())
                    .build());
        }
        log.warn("[config] no embedding model configured; semantic similarity will be neutral");
        return new UnavailableEmbeddingProvider();
    }
}
