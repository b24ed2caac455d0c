package com.verlumen.chrono.collector;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.inject.Inject;
import com.verlumen.chrono.http.HttpClient;
import com.verlumen.chrono.http.HttpResponse;
import com.verlumen.chrono.marketdata.IngestBatch;
import com.verlumen.chrono.marketdata.IngestResult;
import com.verlumen.chrono.marketdata.MarketDataJson;
import java.io.IOException;
import java.time.Duration;

/**
 * Posts batches to {@code {api_base}/internal/ingest} with bearer authentication.
 *
 * <p>Only validation answers (400 and 422) are final: the gateway looked at the batch and refused
 * it, so retrying the same bytes cannot help. Every other non-2xx answer, including 408 and 429,
 * and every I/O failure is a delivery failure and goes through the forwarder's retry backoff.
 */
final class HttpIngestionClient implements IngestionClient {
    private static final FluentLogger logger = FluentLogger.forEnclosingClass();
    private static final ImmutableSet<Integer> VALIDATION_REJECTIONS = ImmutableSet.of(400, 422);

    private final HttpClient httpClient;
    private final String ingestUrl;
    private final ImmutableMap<String, String> headers;

    @Inject
    HttpIngestionClient(HttpClient httpClient, CollectorConfig config) {
        this.httpClient = httpClient;
        this.ingestUrl = config.ingestUrl();
        this.headers = ImmutableMap.of("Authorization", "Bearer " + config.apiKey());
    }

    @Override
    public IngestResult deliver(IngestBatch batch) throws DeliveryException {
        String body = MarketDataJson.toJson(batch).toString();
        HttpResponse response;
        try {
            response = httpClient.postJson(ingestUrl, headers, body);
        } catch (IOException e) {
            throw new DeliveryException("Could not reach " + ingestUrl, e);
        }

        if (response.isSuccessful()) {
            try {
                return MarketDataJson.resultFromJson(JsonParser.parseString(response.body()).getAsJsonObject());
            } catch (JsonParseException | IllegalStateException e) {
                throw new DeliveryException("Unreadable ingest response: " + response.body(), e);
            }
        }
        if (VALIDATION_REJECTIONS.contains(response.statusCode())) {
            logger.atWarning().log("Batch of %d feeds rejected with HTTP %d: %s",
                batch.feeds().size(), response.statusCode(), response.body());
            return rejection(batch, response);
        }
        throw new DeliveryException(
            String.format("Ingest failed with HTTP %d: %s", response.statusCode(), response.body()));
    }

    /** Uses the gateway's itemized answer when it accounts for the whole batch. */
    private static IngestResult rejection(IngestBatch batch, HttpResponse response) {
        try {
            IngestResult result =
                MarketDataJson.resultFromJson(JsonParser.parseString(response.body()).getAsJsonObject());
            if (result.submitted() == batch.feeds().size()) {
                return result;
            }
        } catch (JsonParseException | IllegalStateException e) {
            logger.atFine().withCause(e).log("Rejection body is not an ingest result");
        }
        return IngestResult.rejected(
            batch.feeds().size(),
            Duration.ZERO,
            String.format("HTTP %d: %s", response.statusCode(), response.body()));
    }
}
