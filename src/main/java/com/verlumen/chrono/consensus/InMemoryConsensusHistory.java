package com.verlumen.chrono.consensus;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.verlumen.chrono.marketdata.ConsensusRecord;
import java.util.List;

/** History for DRY runs. Keeps a bounded tail per symbol. */
@Singleton
final class InMemoryConsensusHistory implements ConsensusHistory {
    static final int MAX_RECORDS_PER_SYMBOL = 1_000;

    private final ListMultimap<String, ConsensusRecord> records = LinkedListMultimap.create();

    @Inject
    InMemoryConsensusHistory() {}

    @Override
    public synchronized void append(ConsensusRecord record) {
        List<ConsensusRecord> series = records.get(record.symbol());
        series.add(record);
        if (series.size() > MAX_RECORDS_PER_SYMBOL) {
            series.remove(0);
        }
    }

    /** Oldest first. */
    synchronized ImmutableList<ConsensusRecord> records(String symbol) {
        return ImmutableList.copyOf(records.get(symbol));
    }

    @Override
    public void close() {}
}
