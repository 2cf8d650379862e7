package com.example.contentops.flowguard.quality;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Sliding one-minute window of embedding call slots shared by every session. {@link #reserve()}
 * books the earliest free slot and returns how long the caller must wait for it.
 */
public class EmbeddingRateLimiter {

    static final Duration WINDOW = Duration.ofSeconds(60);

    private final int maxCallsPerMinute;
    private final Clock clock;
    // ascending
    private final List<Instant> slots = new ArrayList<>();

    public EmbeddingRateLimiter(int maxCallsPerMinute, Clock clock) {
        if (maxCallsPerMinute <= 0) {
            throw new IllegalArgumentException("maxCallsPerMinute must be positive");
        }
        this.maxCallsPerMinute = maxCallsPerMinute;
        this.clock = clock;
    }

    public synchronized Duration reserve() {
        Instant now = clock.instant();
        Instant windowStart = now.minus(WINDOW);
        while (!slots.isEmpty() && !slots.get(0).isAfter(windowStart)) {
            slots.remove(0);
        }
        if (slots.size() < maxCallsPerMinute) {
            slots.add(now);
            return Duration.ZERO;
        }
        Instant slot = slots.get(slots.size() - maxCallsPerMinute).plus(WINDOW);
        if (slot.isBefore(now)) {
            slot = now;
        }
        slots.add(slot);
        return Duration.between(now, slot);
    }
}
