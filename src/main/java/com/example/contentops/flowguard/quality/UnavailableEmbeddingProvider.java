package com.example.contentops.flowguard.quality;

/** Placeholder used when no embedding model is configured. */
public class UnavailableEmbeddingProvider implements EmbeddingProvider {

    @Override
    public float[] embed(String text) {
        throw new IllegalStateException("No embedding model configured");
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
