package com.example.contentops.flowguard.quality;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;

/** Adapts a LangChain4j {@link EmbeddingModel}. */
public class LangChain4jEmbeddingProvider implements EmbeddingProvider {

    private final EmbeddingModel embeddingModel;

    public LangChain4jEmbeddingProvider(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    @Override
    public float[] embed(String text) {
        Response<Embedding> response = embeddingModel.embed(text);
        if (response == null || response.content() == null) {
            throw new IllegalStateException("Embedding model returned no content");
        }
        return response.content().vector();
    }
}
