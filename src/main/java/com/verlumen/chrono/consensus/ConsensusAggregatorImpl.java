package com.verlumen.chrono.consensus;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.Multimaps;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.chrono.cache.PublishedPriceCache;
import com.verlumen.chrono.gateway.PriceFeedStore;
import com.verlumen.chrono.marketdata.ConsensusRecord;
import com.verlumen.chrono.marketdata.PriceFeed;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

final class ConsensusAggregatorImpl implements ConsensusAggregator {
    private static final FluentLogger logger = FluentLogger.forEnclosingClass();

    private final PriceFeedStore store;
    private final ConsensusCalculator calculator;
    private final ConsensusHistory history;
    private final PublishedPriceCache cache;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final ConsensusConfig config;

    private ScheduledFuture<?> schedule;

    @Inject
    ConsensusAggregatorImpl(
        PriceFeedStore store,
        ConsensusCalculator calculator,
        ConsensusHistory history,
        PublishedPriceCache cache,
        ScheduledExecutorService scheduler,
        Clock clock,
        ConsensusConfig config) {
        this.store = store;
        this.calculator = calculator;
        this.history = history;
        this.cache = cache;
        this.scheduler = scheduler;
        this.clock = clock;
        this.config = config;
    }

    @Override
    public synchronized void start() {
        checkState(schedule == null, "Aggregator already started");
        long cadenceMillis = config.cadence().toMillis();
        logger.atInfo().log("Aggregating every %d ms over a %s window, minimum %d sources",
            cadenceMillis, config.window(), config.minimumSources());
        schedule = scheduler.scheduleAtFixedRate(
            this::runScheduledCycle, cadenceMillis, cadenceMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public synchronized void shutdown() {
        if (schedule != null) {
            schedule.cancel(false);
            schedule = null;
        }
        history.close();
        logger.atInfo().log("Consensus aggregator stopped");
    }

    @Override
    public ImmutableList<ConsensusRecord> runCycle() {
        Instant asOf = clock.instant();
        // One snapshot per cycle: every symbol is computed from the same view of the store.
        ImmutableList<PriceFeed> snapshot = store.snapshot(asOf.minus(config.window()), asOf);
        ImmutableListMultimap<String, PriceFeed> bySymbol = Multimaps.index(snapshot, PriceFeed::symbol);

        ImmutableList.Builder<ConsensusRecord> published = ImmutableList.builder();
        for (String symbol : bySymbol.keySet()) {
            Optional<ConsensusRecord> record =
                calculator.compute(symbol, bySymbol.get(symbol), config.minimumSources());
            if (record.isEmpty()) {
                logger.atFine().log("No consensus for %s: fewer than %d sources in window",
                    symbol, config.minimumSources());
                continue;
            }
            history.append(record.get());
            cache.publishConsensus(record.get());
            published.add(record.get());
        }
        ImmutableList<ConsensusRecord> records = published.build();
        logger.atFine().log("Cycle at %s published %d of %d symbols", asOf, records.size(), bySymbol.keySet().size());
        return records;
    }

    @Override
    public Optional<ConsensusRecord> aggregate(String symbol) {
        Instant asOf = clock.instant();
        return calculator.compute(
            symbol, store.snapshot(asOf.minus(config.window()), asOf), config.minimumSources());
    }

    /** A failed cycle must not cancel the schedule. */
    private void runScheduledCycle() {
        try {
            runCycle();
        } catch (RuntimeException e) {
            logger.atSevere().withCause(e).log("Consensus cycle failed");
        }
    }
}
