package com.example.contentops.flowguard.quality;

/** Source of text embeddings for semantic similarity. Calls may block and may fail. */
public interface EmbeddingProvider {

    float[] embed(String text);

    /** False when no embedding backend is configured; callers then skip the call entirely. */
    default boolean isAvailable() {
        return true;
    }
}
