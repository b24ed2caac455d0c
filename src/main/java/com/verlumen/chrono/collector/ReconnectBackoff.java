package com.verlumen.chrono.collector;

import static com.google.common.base.Preconditions.checkArgument;

import java.time.Duration;

/**
 * Doubling backoff: attempt {@code k} (1-indexed) waits {@code min(base * 2^(k-1), max)}.
 *
 * <p>{@code maxAttempts} bounds how many consecutive retries are scheduled before giving up.
 */
public record ReconnectBackoff(Duration baseDelay, Duration maxDelay, int maxAttempts) {
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);

    public ReconnectBackoff {
        checkArgument(!baseDelay.isNegative() && !baseDelay.isZero(), "Base delay must be positive");
        checkArgument(maxDelay.compareTo(baseDelay) >= 0, "Max delay must not be below base delay");
        checkArgument(maxAttempts >= 0, "Max attempts must not be negative: %s", maxAttempts);
    }

    public static ReconnectBackoff create(int maxAttempts) {
        return new ReconnectBackoff(DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY, maxAttempts);
    }

    public Duration delayFor(int attempt) {
        checkArgument(attempt >= 1, "Attempts are 1-indexed: %s", attempt);
        Duration delay = baseDelay;
        for (int i = 1; i < attempt; i++) {
            delay = delay.multipliedBy(2);
            if (delay.compareTo(maxDelay) >= 0) {
                return maxDelay;
            }
        }
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }
}
