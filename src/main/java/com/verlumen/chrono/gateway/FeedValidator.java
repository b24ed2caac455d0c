package com.verlumen.chrono.gateway;

import com.google.inject.Inject;
import com.verlumen.chrono.marketdata.IngestBatch;
import com.verlumen.chrono.marketdata.PriceFeed;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.regex.Pattern;

/** Wire-level rules for ingest requests. Each check returns the reason for rejection, if any. */
final class FeedValidator {
    private static final Pattern WORKER_ID = Pattern.compile("^[a-z0-9_-]{1,100}$");
    private static final Pattern SYMBOL = Pattern.compile("^[A-Z]+/[A-Z]+$");
    private static final Pattern SOURCE = Pattern.compile("^[a-z0-9_-]{1,50}$");
    private static final int MIN_SYMBOL_LENGTH = 5;
    private static final int MAX_SYMBOL_LENGTH = 20;

    private final Clock clock;
    private final Duration maxFutureSkew;

    @Inject
    FeedValidator(Clock clock, GatewayConfig config) {
        this.clock = clock;
        this.maxFutureSkew = config.maxFutureSkew();
    }

    Optional<String> validateBatch(String workerId, int feedCount) {
        if (workerId == null || !WORKER_ID.matcher(workerId).matches()) {
            return Optional.of("Worker ID must be 1-100 lowercase alphanumeric characters, hyphens or underscores");
        }
        if (feedCount == 0) {
            return Optional.of("At least one price feed required");
        }
        if (feedCount > IngestBatch.MAX_FEEDS) {
            return Optional.of(String.format(
                "Maximum %d price feeds per batch, got %d", IngestBatch.MAX_FEEDS, feedCount));
        }
        return Optional.empty();
    }

    Optional<String> validateFeed(PriceFeed feed) {
        String symbol = feed.symbol();
        if (symbol.length() < MIN_SYMBOL_LENGTH
            || symbol.length() > MAX_SYMBOL_LENGTH
            || !SYMBOL.matcher(symbol).matches()) {
            return Optional.of("Symbol must be in format BASE/QUOTE (e.g., BTC/USD)");
        }
        if (feed.price().signum() <= 0) {
            return Optional.of("Price must be greater than 0");
        }
        if (feed.volume().isPresent() && feed.volume().get().signum() < 0) {
            return Optional.of("Volume must be non-negative");
        }
        if (!SOURCE.matcher(feed.source()).matches()) {
            return Optional.of("Source must be 1-50 lowercase alphanumeric characters, hyphens or underscores");
        }
        if (feed.timestamp().isAfter(clock.instant().plus(maxFutureSkew))) {
            return Optional.of("Timestamp is too far in the future: " + feed.timestamp());
        }
        return Optional.empty();
    }
}
