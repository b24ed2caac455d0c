package com.verlumen.chrono.marketdata;

/** Why the feed at {@code index} of a batch was not ingested. */
public record IngestError(int index, String symbol, String reason) {}
