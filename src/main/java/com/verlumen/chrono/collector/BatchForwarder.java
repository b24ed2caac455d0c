package com.verlumen.chrono.collector;

import com.verlumen.chrono.marketdata.PriceFeed;

/**
 * Buffers feeds from any number of connections and forwards them in batches.
 *
 * <p>A flush happens when {@code batchSize} feeds are waiting or when the oldest waiting feed has
 * waited {@code batchInterval}, whichever comes first. Feeds leave the buffer only once their
 * batch is acknowledged or finally dropped.
 */
public interface BatchForwarder {
    /** Appends a feed. Never blocks on delivery. */
    void add(PriceFeed feed);

    /**
     * Cancels timers and retries, waits for a delivery already under way, then forwards whatever
     * that delivery did not carry once, synchronously.
     */
    void shutdown();

    ForwarderStats stats();
}
