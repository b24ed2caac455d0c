package com.verlumen.chrono.gateway;

import com.google.common.collect.ImmutableList;
import com.verlumen.chrono.marketdata.PriceFeed;
import java.time.Instant;
import java.util.Optional;

/** Durable feed storage keyed by (symbol, source, timestamp); the last write for a key wins. */
public interface PriceFeedStore {
    void upsert(PriceFeed feed) throws StorageException;

    /** Most recent feed for the symbol from any source. */
    Optional<PriceFeed> latest(String symbol);

    /**
     * Feeds with {@code from <= timestamp <= to}, newest first.
     *
     * @param source restricts results to one source when present
     */
    ImmutableList<PriceFeed> range(
        String symbol, Instant from, Instant to, Optional<String> source, int limit);

    /** Every feed of every symbol with {@code from <= timestamp <= asOf}, read as one consistent view. */
    ImmutableList<PriceFeed> snapshot(Instant from, Instant asOf);

    int size();
}
