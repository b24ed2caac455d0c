package com.verlumen.chrono.gateway;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.verlumen.chrono.marketdata.PriceFeed;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Feed store kept in memory for a trailing retention window. Writers take the write lock, so a
 * reader holding the read lock sees a view no write can tear.
 */
@Singleton
final class InMemoryPriceFeedStore implements PriceFeedStore {
    private static final FluentLogger logger = FluentLogger.forEnclosingClass();

    private final Clock clock;
    private final Duration retention;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    // symbol -> timestamp -> source -> feed
    private final Map<String, NavigableMap<Instant, Map<String, PriceFeed>>> feeds = new HashMap<>();
    private int size;

    @Inject
    InMemoryPriceFeedStore(Clock clock, GatewayConfig config) {
        this.clock = clock;
        this.retention = config.retention();
    }

    @Override
    public void upsert(PriceFeed feed) throws StorageException {
        Instant cutoff = clock.instant().minus(retention);
        if (feed.timestamp().isBefore(cutoff)) {
            throw new StorageException(String.format(
                "Timestamp %s is outside the %s retention window", feed.timestamp(), retention));
        }
        lock.writeLock().lock();
        try {
            NavigableMap<Instant, Map<String, PriceFeed>> series =
                feeds.computeIfAbsent(feed.symbol(), unused -> new TreeMap<>());
            PriceFeed previous = series
                .computeIfAbsent(feed.timestamp(), unused -> new LinkedHashMap<>())
                .put(feed.source(), feed);
            if (previous == null) {
                size++;
            } else {
                logger.atFine().log("Replaced duplicate feed %s", feed.key());
            }
            prune(series, cutoff);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<PriceFeed> latest(String symbol) {
        lock.readLock().lock();
        try {
            NavigableMap<Instant, Map<String, PriceFeed>> series = feeds.get(symbol);
            if (series == null || series.isEmpty()) {
                return Optional.empty();
            }
            Map<String, PriceFeed> newest = series.lastEntry().getValue();
            return newest.values().stream().reduce((first, second) -> second);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public ImmutableList<PriceFeed> range(
        String symbol, Instant from, Instant to, Optional<String> source, int limit) {
        lock.readLock().lock();
        try {
            NavigableMap<Instant, Map<String, PriceFeed>> series = feeds.get(symbol);
            if (series == null || from.isAfter(to)) {
                return ImmutableList.of();
            }
            ImmutableList.Builder<PriceFeed> result = ImmutableList.builder();
            int count = 0;
            for (Map<String, PriceFeed> atInstant : series.subMap(from, true, to, true).descendingMap().values()) {
                for (PriceFeed feed : atInstant.values()) {
                    if (source.isPresent() && !source.get().equals(feed.source())) {
                        continue;
                    }
                    if (count++ >= limit) {
                        return result.build();
                    }
                    result.add(feed);
                }
            }
            return result.build();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public ImmutableList<PriceFeed> snapshot(Instant from, Instant asOf) {
        lock.readLock().lock();
        try {
            ImmutableList.Builder<PriceFeed> result = ImmutableList.builder();
            if (from.isAfter(asOf)) {
                return result.build();
            }
            for (NavigableMap<Instant, Map<String, PriceFeed>> series : feeds.values()) {
                series.subMap(from, true, asOf, true).values().forEach(atInstant -> result.addAll(atInstant.values()));
            }
            return result.build();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return size;
        } finally {
            lock.readLock().unlock();
        }
    }

    private void prune(NavigableMap<Instant, Map<String, PriceFeed>> series, Instant cutoff) {
        NavigableMap<Instant, Map<String, PriceFeed>> expired = series.headMap(cutoff, false);
        if (expired.isEmpty()) {
            return;
        }
        int removed = expired.values().stream().mapToInt(Map::size).sum();
        expired.clear();
        size -= removed;
        logger.atFine().log("Pruned %d feeds older than %s", removed, cutoff);
    }
}
