package com.verlumen.chrono.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * A cached value together with its staleness as seen by the reader. Staleness is computed when
 * the reading is taken and is never stored in the cache itself.
 */
public record CachedReading<T>(T value, Instant timestamp, Duration staleness) {
    public static <T> CachedReading<T> of(T value, Instant timestamp, Instant now) {
        return new CachedReading<>(value, timestamp, Duration.between(timestamp, now));
    }

    public long stalenessMillis() {
        return staleness.toMillis();
    }
}
