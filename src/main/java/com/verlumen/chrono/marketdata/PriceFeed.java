package com.verlumen.chrono.marketdata;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

/**
 * One exchange's price observation for one symbol at one instant.
 *
 * <p>Prices are exact decimals. Construction does not validate ranges: adapters only build feeds
 * they have checked, and the ingestion gateway must be able to represent and itemize malformed
 * feeds it receives over the wire.
 */
@AutoValue
public abstract class PriceFeed {
    public static Builder builder() {
        return new AutoValue_PriceFeed.Builder().setMetadata(ImmutableMap.of());
    }

    /** Canonical "BASE/QUOTE" symbol, e.g. "BTC/USD". */
    public abstract String symbol();

    public abstract BigDecimal price();

    public abstract Optional<BigDecimal> volume();

    public abstract Instant timestamp();

    /** Exchange id, e.g. "coinbase". */
    public abstract String source();

    public abstract String workerId();

    public abstract ImmutableMap<String, String> metadata();

    public abstract Builder toBuilder();

    /** Key under which the store deduplicates feeds. */
    public final FeedKey key() {
        return new FeedKey(symbol(), source(), timestamp());
    }

    @AutoValue.Builder
    public abstract static class Builder {
        public abstract Builder setSymbol(String symbol);

        public abstract Builder setPrice(BigDecimal price);

        public abstract Builder setVolume(BigDecimal volume);

        public abstract Builder setVolume(Optional<BigDecimal> volume);

        public abstract Builder setTimestamp(Instant timestamp);

        public abstract Builder setSource(String source);

        public abstract Builder setWorkerId(String workerId);

        public abstract Builder setMetadata(ImmutableMap<String, String> metadata);

        public abstract PriceFeed build();
    }

    /** Identity of a feed for last-write-wins storage. */
    public record FeedKey(String symbol, String source, Instant timestamp) {}
}
