package com.verlumen.chrono.collector;

import com.verlumen.chrono.marketdata.IngestBatch;
import com.verlumen.chrono.marketdata.IngestResult;

/** Transport from a collector to the ingestion gateway. */
public interface IngestionClient {
    /**
     * Delivers one batch and returns the gateway's accounting for it. A validation rejection is an
     * acknowledged delivery and comes back as a result, not an exception.
     *
     * @throws DeliveryException if the gateway could not be reached or failed to answer
     */
    IngestResult deliver(IngestBatch batch) throws DeliveryException;
}
