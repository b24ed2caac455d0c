package com.verlumen.chrono.consensus;

import com.google.common.collect.ImmutableList;
import com.verlumen.chrono.marketdata.ConsensusRecord;
import java.util.Optional;

/**
 * Periodically reduces recent feeds into one consensus record per symbol and publishes it.
 *
 * <p>Runs on a fixed cadence, independent of how fast feeds arrive.
 */
public interface ConsensusAggregator {
    void start();

    void shutdown();

    /**
     * Runs one cycle over a snapshot of the trailing window ending now, publishing every record
     * that met the source minimum.
     */
    ImmutableList<ConsensusRecord> runCycle();

    /** Computes, without publishing, the consensus for one symbol over the trailing window. */
    Optional<ConsensusRecord> aggregate(String symbol);
}
