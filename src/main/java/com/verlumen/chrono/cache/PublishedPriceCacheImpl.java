package com.verlumen.chrono.cache;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.chrono.marketdata.ConsensusRecord;
import com.verlumen.chrono.marketdata.PriceFeed;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

final class PublishedPriceCacheImpl implements PublishedPriceCache {
    private static final FluentLogger logger = FluentLogger.forEnclosingClass();

    private final Clock clock;
    private final PriceBroadcaster broadcaster;
    private final Map<String, ConsensusRecord> consensusBySymbol = new ConcurrentHashMap<>();
    private final Map<String, Map<String, PriceFeed>> feedsBySymbol = new ConcurrentHashMap<>();

    @Inject
    PublishedPriceCacheImpl(Clock clock, PriceBroadcaster broadcaster) {
        this.clock = clock;
        this.broadcaster = broadcaster;
    }

    @Override
    public void updateFeed(PriceFeed feed) {
        feedsBySymbol
            .computeIfAbsent(feed.symbol(), unused -> new ConcurrentHashMap<>())
            .merge(feed.source(), feed,
                (cached, incoming) -> incoming.timestamp().isBefore(cached.timestamp()) ? cached : incoming);
    }

    @Override
    public void publishConsensus(ConsensusRecord record) {
        ConsensusRecord stored = consensusBySymbol.merge(record.symbol(), record,
            (cached, incoming) -> incoming.timestamp().isBefore(cached.timestamp()) ? cached : incoming);
        if (stored != record) {
            logger.atFine().log("Ignoring out-of-order consensus for %s at %s", record.symbol(), record.timestamp());
            return;
        }
        broadcaster.publish(record);
    }

    @Override
    public Optional<CachedReading<ConsensusRecord>> latestConsensus(String symbol) {
        Instant now = clock.instant();
        return Optional.ofNullable(consensusBySymbol.get(symbol))
            .map(record -> CachedReading.of(record, record.timestamp(), now));
    }

    @Override
    public Optional<CachedReading<PriceFeed>> latestFeed(String symbol) {
        return latestFeedsBySource(symbol).stream().findFirst();
    }

    @Override
    public ImmutableList<CachedReading<PriceFeed>> latestFeedsBySource(String symbol) {
        Map<String, PriceFeed> feeds = feedsBySymbol.get(symbol);
        if (feeds == null) {
            return ImmutableList.of();
        }
        Instant now = clock.instant();
        return feeds.values().stream()
            .sorted(Comparator.comparing(PriceFeed::timestamp).reversed())
            .map(feed -> CachedReading.of(feed, feed.timestamp(), now))
            .collect(toImmutableList());
    }

    @Override
    public Subscription subscribe(ImmutableSet<String> symbols) {
        return broadcaster.subscribe(symbols);
    }
}
