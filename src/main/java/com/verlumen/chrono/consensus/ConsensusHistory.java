package com.verlumen.chrono.consensus;

import com.verlumen.chrono.marketdata.ConsensusRecord;

/** Append-only record of every published consensus. */
public interface ConsensusHistory extends AutoCloseable {
    void append(ConsensusRecord record);

    @Override
    void close();
}
