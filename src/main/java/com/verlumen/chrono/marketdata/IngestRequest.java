package com.verlumen.chrono.marketdata;

import com.google.common.collect.ImmutableList;
import java.time.Instant;
import java.util.Optional;

/**
 * An ingest request as read off the wire. Each entry keeps its position in the request and holds
 * either a readable feed or the reason it could not be read, so one bad entry never hides its
 * siblings.
 */
public record IngestRequest(String workerId, Instant timestamp, ImmutableList<Entry> entries) {
    public static IngestRequest of(IngestBatch batch) {
        return new IngestRequest(
            batch.workerId(),
            batch.timestamp(),
            batch.feeds().stream().map(Entry::readable).collect(ImmutableList.toImmutableList()));
    }

    public int size() {
        return entries.size();
    }

    /** One position of the request's feeds array. */
    public record Entry(Optional<PriceFeed> feed, String symbol, String error) {
        public static Entry readable(PriceFeed feed) {
            return new Entry(Optional.of(feed), feed.symbol(), "");
        }

        public static Entry unreadable(String symbol, String error) {
            return new Entry(Optional.empty(), symbol, error);
        }
    }
}
