package com.verlumen.chrono.cache;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.verlumen.chrono.marketdata.ConsensusRecord;
import com.verlumen.chrono.marketdata.PriceFeed;
import java.util.Optional;

/**
 * Latest consensus record per symbol and latest raw feed per symbol and source, for low-latency
 * reads and live fan-out.
 */
public interface PublishedPriceCache {
    /** Keeps {@code feed} unless a newer feed from the same source is already cached. */
    void updateFeed(PriceFeed feed);

    /** Replaces the cached record for the symbol and pushes it to every matching subscriber. */
    void publishConsensus(ConsensusRecord record);

    Optional<CachedReading<ConsensusRecord>> latestConsensus(String symbol);

    /** The freshest feed for the symbol across all sources. */
    Optional<CachedReading<PriceFeed>> latestFeed(String symbol);

    /** One reading per source, freshest first. */
    ImmutableList<CachedReading<PriceFeed>> latestFeedsBySource(String symbol);

    /**
     * Opens a live consensus subscription.
     *
     * @param symbols symbols to receive; empty receives every symbol
     */
    Subscription subscribe(ImmutableSet<String> symbols);
}
