package com.verlumen.chrono.gateway;

import com.verlumen.chrono.marketdata.IngestBatch;
import com.verlumen.chrono.marketdata.IngestRequest;
import com.verlumen.chrono.marketdata.IngestResult;

/**
 * Validates and persists feed batches sent by collectors. Safe for concurrent use by any number
 * of workers.
 */
public interface IngestionGateway {
    /**
     * Ingests one batch. A malformed batch (bad worker id, no feeds, more than
     * {@link IngestBatch#MAX_FEEDS}) is rejected whole. Otherwise every feed is validated and
     * stored independently and failures are itemized by index.
     */
    IngestResult ingest(IngestBatch batch);

    /** Ingests a request read off the wire; unreadable entries count as failed items at their index. */
    IngestResult ingest(IngestRequest request);
}
