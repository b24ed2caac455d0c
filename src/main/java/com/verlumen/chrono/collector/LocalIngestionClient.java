package com.verlumen.chrono.collector;

import com.google.inject.Inject;
import com.verlumen.chrono.gateway.IngestionGateway;
import com.verlumen.chrono.marketdata.IngestBatch;
import com.verlumen.chrono.marketdata.IngestResult;

/** Hands batches straight to a gateway in the same process. */
final class LocalIngestionClient implements IngestionClient {
    private final IngestionGateway gateway;

    @Inject
    LocalIngestionClient(IngestionGateway gateway) {
        this.gateway = gateway;
    }

    @Override
    public IngestResult deliver(IngestBatch batch) {
        return gateway.ingest(batch);
    }
}
