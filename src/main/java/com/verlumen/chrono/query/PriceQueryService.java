package com.verlumen.chrono.query;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.flogger.FluentLogger;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.inject.Inject;
import com.verlumen.chrono.cache.CachedReading;
import com.verlumen.chrono.cache.PublishedPriceCache;
import com.verlumen.chrono.consensus.ConsensusCalculator;
import com.verlumen.chrono.consensus.ConsensusConfig;
import com.verlumen.chrono.gateway.PriceFeedStore;
import com.verlumen.chrono.marketdata.ConsensusRecord;
import com.verlumen.chrono.marketdata.MarketDataJson;
import com.verlumen.chrono.marketdata.OhlcvBar;
import com.verlumen.chrono.marketdata.PriceFeed;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Read boundary over the cache and the feed store. Cached values are preferred; the store is the
 * fallback for symbols the cache has not seen.
 */
public final class PriceQueryService {
    private static final FluentLogger logger = FluentLogger.forEnclosingClass();
    public static final int DEFAULT_LIMIT = 1_000;
    public static final int MAX_LIMIT = 10_000;
    static final Duration CONSENSUS_FALLBACK_WINDOW = Duration.ofMinutes(5);

    private final PublishedPriceCache cache;
    private final PriceFeedStore store;
    private final ConsensusCalculator calculator;
    private final ConsensusConfig consensusConfig;
    private final Clock clock;

    @Inject
    PriceQueryService(
        PublishedPriceCache cache,
        PriceFeedStore store,
        ConsensusCalculator calculator,
        ConsensusConfig consensusConfig,
        Clock clock) {
        this.cache = cache;
        this.store = store;
        this.calculator = calculator;
        this.consensusConfig = consensusConfig;
        this.clock = clock;
    }

    /** Latest raw price per symbol. Symbols with no data at all are left out. */
    public ImmutableMap<String, CachedReading<PriceFeed>> latestPrices(Iterable<String> symbols) {
        Instant now = clock.instant();
        ImmutableMap.Builder<String, CachedReading<PriceFeed>> result = ImmutableMap.builder();
        for (String symbol : symbols) {
            Optional<CachedReading<PriceFeed>> reading = cache.latestFeed(symbol);
            if (reading.isEmpty()) {
                reading = store.latest(symbol).map(feed -> CachedReading.of(feed, feed.timestamp(), now));
            }
            reading.ifPresent(value -> result.put(symbol, value));
        }
        return result.buildKeepingLast();
    }

    /**
     * Feeds of one symbol between {@code from} and {@code to}, inclusive.
     *
     * @throws IllegalArgumentException for an inverted range or a limit outside 1..{@value #MAX_LIMIT}
     */
    public PriceRange priceRange(
        String symbol,
        Instant from,
        Instant to,
        Optional<Interval> interval,
        Optional<String> source,
        int limit) {
        checkArgument(!from.isAfter(to), "from (%s) must not be after to (%s)", from, to);
        checkArgument(limit >= 1 && limit <= MAX_LIMIT, "limit must be between 1 and %s: %s", MAX_LIMIT, limit);

        if (interval.isEmpty()) {
            return new PriceRange(
                symbol, interval, store.range(symbol, from, to, source, limit), ImmutableList.of());
        }

        ImmutableList<PriceFeed> newestFirst = store.range(symbol, from, to, source, MAX_LIMIT);
        if (newestFirst.size() == MAX_LIMIT) {
            logger.atWarning().log("Range for %s truncated at %d feeds before bucketing", symbol, MAX_LIMIT);
        }
        ImmutableList<OhlcvBar> bars = bucket(symbol, Lists.reverse(newestFirst), interval.get());
        if (bars.size() > limit) {
            bars = bars.subList(bars.size() - limit, bars.size());
        }
        return new PriceRange(symbol, interval, ImmutableList.of(), bars);
    }

    /**
     * Latest consensus per symbol. Symbols without a cached record are computed on demand over the
     * last five minutes of stored feeds; symbols without enough sources are left out.
     */
    public ImmutableMap<String, CachedReading<ConsensusRecord>> consensus(Iterable<String> symbols) {
        Instant now = clock.instant();
        ImmutableList<PriceFeed> fallbackSnapshot = null;
        ImmutableMap.Builder<String, CachedReading<ConsensusRecord>> result = ImmutableMap.builder();
        for (String symbol : symbols) {
            Optional<CachedReading<ConsensusRecord>> reading = cache.latestConsensus(symbol);
            if (reading.isEmpty()) {
                if (fallbackSnapshot == null) {
                    fallbackSnapshot = store.snapshot(now.minus(CONSENSUS_FALLBACK_WINDOW), now);
                }
                reading = calculator
                    .compute(symbol, fallbackSnapshot, consensusConfig.minimumSources())
                    .map(record -> CachedReading.of(record, record.timestamp(), now));
            }
            reading.ifPresent(value -> result.put(symbol, value));
        }
        return result.buildKeepingLast();
    }

    public static JsonArray latestPricesJson(ImmutableMap<String, CachedReading<PriceFeed>> prices) {
        JsonArray array = new JsonArray();
        prices.values().forEach(reading -> {
            JsonObject json = MarketDataJson.toJson(reading.value());
            json.addProperty("staleness_ms", reading.stalenessMillis());
            array.add(json);
        });
        return array;
    }

    public static JsonArray consensusJson(ImmutableMap<String, CachedReading<ConsensusRecord>> records) {
        JsonArray array = new JsonArray();
        records.values().forEach(reading -> {
            JsonObject json = MarketDataJson.toJson(reading.value());
            json.addProperty("staleness_ms", reading.stalenessMillis());
            array.add(json);
        });
        return array;
    }

    private static ImmutableList<OhlcvBar> bucket(
        String symbol, Iterable<PriceFeed> oldestFirst, Interval interval) {
        ImmutableList.Builder<OhlcvBar> bars = ImmutableList.builder();
        OhlcvBuilder current = null;
        Instant currentStart = null;
        for (PriceFeed feed : oldestFirst) {
            Instant start = interval.bucketStart(feed.timestamp());
            if (!start.equals(currentStart)) {
                if (current != null) {
                    bars.add(current.build());
                }
                current = new OhlcvBuilder(symbol, start);
                currentStart = start;
            }
            current.add(feed);
        }
        if (current != null && current.hasFeeds()) {
            bars.add(current.build());
        }
        return bars.build();
    }
}
