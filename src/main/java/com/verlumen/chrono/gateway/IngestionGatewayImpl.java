package com.verlumen.chrono.gateway;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.chrono.cache.PublishedPriceCache;
import com.verlumen.chrono.marketdata.IngestBatch;
import com.verlumen.chrono.marketdata.IngestError;
import com.verlumen.chrono.marketdata.IngestRequest;
import com.verlumen.chrono.marketdata.IngestResult;
import com.verlumen.chrono.marketdata.PriceFeed;
import java.time.Duration;
import java.util.Optional;

final class IngestionGatewayImpl implements IngestionGateway {
    private static final FluentLogger logger = FluentLogger.forEnclosingClass();

    private final FeedValidator validator;
    private final PriceFeedStore store;
    private final PublishedPriceCache cache;
    private final Ticker ticker;

    @Inject
    IngestionGatewayImpl(
        FeedValidator validator, PriceFeedStore store, PublishedPriceCache cache, Ticker ticker) {
        this.validator = validator;
        this.store = store;
        this.cache = cache;
        this.ticker = ticker;
    }

    @Override
    public IngestResult ingest(IngestBatch batch) {
        return ingest(IngestRequest.of(batch));
    }

    @Override
    public IngestResult ingest(IngestRequest request) {
        Stopwatch stopwatch = Stopwatch.createStarted(ticker);
        int submitted = request.size();

        Optional<String> shapeError = validator.validateBatch(request.workerId(), submitted);
        if (shapeError.isPresent()) {
            logger.atWarning().log("Rejected batch of %d feeds from '%s': %s",
                submitted, request.workerId(), shapeError.get());
            return IngestResult.rejected(submitted, stopwatch.elapsed(), shapeError.get());
        }

        logger.atFine().log("Processing %d feeds from %s", submitted, request.workerId());
        ImmutableList.Builder<IngestError> errors = ImmutableList.builder();
        int ingested = 0;
        for (int index = 0; index < submitted; index++) {
            IngestRequest.Entry entry = request.entries().get(index);
            if (entry.feed().isEmpty()) {
                errors.add(new IngestError(index, entry.symbol(), entry.error()));
                continue;
            }
            PriceFeed feed = entry.feed().get();
            Optional<String> feedError = validator.validateFeed(feed);
            if (feedError.isPresent()) {
                errors.add(new IngestError(index, feed.symbol(), feedError.get()));
                continue;
            }
            try {
                store.upsert(feed);
            } catch (StorageException e) {
                logger.atWarning().withCause(e).log("Failed to store feed %s", feed.key());
                errors.add(new IngestError(index, feed.symbol(), "Storage failure: " + e.getMessage()));
                continue;
            }
            cache.updateFeed(feed);
            ingested++;
        }

        ImmutableList<IngestError> itemErrors = errors.build();
        int failed = itemErrors.size();
        IngestResult.Status status = IngestResult.Status.of(ingested, failed);
        Duration latency = stopwatch.elapsed();
        IngestResult result =
            new IngestResult(status, ingested, failed, latency, message(status, ingested, submitted), itemErrors);

        if (failed == 0) {
            logger.atInfo().log("Ingested %d feeds from %s in %d ms", ingested, request.workerId(), latency.toMillis());
        } else {
            logger.atWarning().log("Ingested %d of %d feeds from %s in %d ms; first error: %s",
                ingested, submitted, request.workerId(), latency.toMillis(), itemErrors.get(0));
        }
        return result;
    }

    private static String message(IngestResult.Status status, int ingested, int submitted) {
        switch (status) {
            case SUCCESS:
                return String.format("%d price feeds ingested successfully", ingested);
            case PARTIAL:
                return String.format("%d of %d price feeds ingested", ingested, submitted);
            default:
                return String.format("None of %d price feeds ingested", submitted);
        }
    }
}
