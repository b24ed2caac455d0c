package com.verlumen.chrono.collector;

/**
 * Forwarder counters since start.
 *
 * @param feedsReceived feeds handed to {@link BatchForwarder#add}
 * @param feedsIngested feeds the gateway stored
 * @param feedsRejected feeds the gateway refused
 * @param batchesSent acknowledged batches
 * @param feedsDropped feeds lost to exhausted retries, buffer eviction or late arrival
 * @param buffered feeds currently waiting, including an in-flight batch
 */
public record ForwarderStats(
    long feedsReceived,
    long feedsIngested,
    long feedsRejected,
    long batchesSent,
    long feedsDropped,
    int buffered) {}
