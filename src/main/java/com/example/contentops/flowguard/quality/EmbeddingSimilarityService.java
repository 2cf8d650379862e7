package com.example.contentops.flowguard.quality;

import com.example.contentops.flowguard.config.MonitorProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.store.embedding.CosineSimilarity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;

/**
 * Cosine similarity of two texts from cached, rate-limited embeddings. Any provider failure yields
 * the neutral score 0.5.
 */
@Slf4j
@Service
public class EmbeddingSimilarityService {

    static final double NEUTRAL_SCORE = 0.5;

    private final EmbeddingProvider provider;
    private final EmbeddingRateLimiter rateLimiter;
    private final int maxInputChars;
    // keyed by md5 of the (truncated) text
    private final Cache<String, float[]> cache;

    @Autowired
    public EmbeddingSimilarityService(EmbeddingProvider provider, MonitorProperties props, Clock clock) {
        this(provider, new EmbeddingRateLimiter(props.getEmbedding().getMaxCallsPerMinute(), clock),
                props.getEmbedding().getMaxInputChars(), props.getEmbedding().getCacheSize());
    }

    EmbeddingSimilarityService(EmbeddingProvider provider, EmbeddingRateLimiter rateLimiter, int maxInputChars,
                               int cacheSize) {
        this.provider = provider;
        this.rateLimiter = rateLimiter;
        this.maxInputChars = maxInputChars;
        this.cache = Caffeine.newBuilder()
                .maximumSize(cacheSize)
                .executor(Runnable::run)
                .build();
    }

    public Mono<Double> similarity(String first, String second) {
        if (first == null || first.isBlank() || second == null || second.isBlank()) {
            return Mono.just(0.0);
        }
        if (!provider.isAvailable()) {
            return Mono.just(NEUTRAL_SCORE);
        }
        return Mono.zip(embedding(first), embedding(second))
                .map(pair -> TextSignals.clamp(
                        CosineSimilarity.between(Embedding.from(pair.getT1()), Embedding.from(pair.getT2()))))
                .onErrorResume(ex -> {
                    log.warn("[embedding] similarity failed, using neutral score: {}", ex.toString());
                    return Mono.just(NEUTRAL_SCORE);
                });
    }

    Mono<float[]> embedding(String text) {
        String input = text.length() > maxInputChars ? text.substring(0, maxInputChars) : text;
        String key = DigestUtils.md5DigestAsHex(input.getBytes(StandardCharsets.UTF_8));
        float[] cached = cache.getIfPresent(key);
        if (cached != null) {
            return Mono.just(cached);
        }
        return Mono.defer(() -> {
                    Duration wait = rateLimiter.reserve();
                    Mono<Long> gate = Mono.just(0L);
                    if (!wait.isZero()) {
                        log.info("[embedding] rate limit reached, delaying call by {} ms", wait.toMillis());
                        gate = Mono.delay(wait);
                    }
                    return gate.then(Mono.fromCallable(() -> provider.embed(input))
                            .subscribeOn(Schedulers.boundedElastic()));
                })
                .doOnNext(vector -> cache.put(key, vector));
    }

    long cacheSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
