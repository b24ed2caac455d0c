package com.verlumen.chrono.marketdata;

import com.google.common.collect.ImmutableList;
import java.time.Instant;

/**
 * A bounded group of feeds forwarded together by one worker.
 *
 * <p>Size bounds are enforced by the gateway, which has to report an oversized batch rather than
 * fail to build it.
 */
public record IngestBatch(String workerId, Instant timestamp, ImmutableList<PriceFeed> feeds) {
    public static final int MAX_FEEDS = 100;

    public static IngestBatch create(String workerId, Instant timestamp, Iterable<PriceFeed> feeds) {
        return new IngestBatch(workerId, timestamp, ImmutableList.copyOf(feeds));
    }
}
