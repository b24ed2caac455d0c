package com.verlumen.chrono.collector;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.collect.ImmutableSortedSet.toImmutableSortedSet;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Ordering;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.chrono.marketdata.IngestBatch;
import com.verlumen.chrono.marketdata.IngestError;
import com.verlumen.chrono.marketdata.IngestResult;
import com.verlumen.chrono.marketdata.PriceFeed;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Single shared buffer guarded by one lock. At most one batch is in flight; it is always the head
 * of the buffer, and {@code inFlight} counts how many head entries belong to it. Delivery runs on
 * the scheduler, never on the thread that called {@link #add}.
 */
final class BatchForwarderImpl implements BatchForwarder {
    private static final FluentLogger logger = FluentLogger.forEnclosingClass();
    private static final Duration IN_FLIGHT_SHUTDOWN_WAIT = Duration.ofSeconds(30);

    private final IngestionClient client;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final String workerId;
    private final int batchSize;
    private final Duration batchInterval;
    private final int bufferCeiling;
    private final ReconnectBackoff deliveryBackoff;

    private final Object lock = new Object();
    private final List<BufferedFeed> buffer = new ArrayList<>();
    private int inFlight;
    private boolean flushing;
    private boolean delivering;
    private boolean stopped;
    private boolean finalFlushTaken;
    private ScheduledFuture<?> flushTimer;
    private ScheduledFuture<?> pendingRetry;

    private long feedsReceived;
    private long feedsIngested;
    private long feedsRejected;
    private long batchesSent;
    private long feedsDropped;

    @Inject
    BatchForwarderImpl(
        IngestionClient client, ScheduledExecutorService scheduler, Clock clock, CollectorConfig config) {
        this.client = client;
        this.scheduler = scheduler;
        this.clock = clock;
        this.workerId = config.workerId();
        this.batchSize = config.batchSize();
        this.batchInterval = config.batchInterval();
        this.bufferCeiling = config.bufferCeiling();
        this.deliveryBackoff = config.deliveryBackoff();
    }

    @Override
    public void add(PriceFeed feed) {
        synchronized (lock) {
            feedsReceived++;
            if (stopped) {
                feedsDropped++;
                logger.atWarning().log("Dropping %s feed from %s received after shutdown",
                    feed.symbol(), feed.source());
                return;
            }
            if (buffer.size() >= bufferCeiling) {
                evictOldestUnsent();
            }
            buffer.add(new BufferedFeed(feed, clock.instant()));
            if (flushing) {
                return;
            }
            if (buffer.size() >= batchSize) {
                startFlush();
            } else if (flushTimer == null) {
                scheduleFlushTimer(batchInterval);
            }
        }
    }

    @Override
    public void shutdown() {
        ImmutableList<PriceFeed> remaining;
        synchronized (lock) {
            if (stopped) {
                return;
            }
            stopped = true;
            cancel(flushTimer);
            cancel(pendingRetry);
            flushTimer = null;
            pendingRetry = null;
            awaitDeliveryInProgress();
            finalFlushTaken = true;
            remaining = buffer.stream().map(BufferedFeed::feed).collect(toImmutableList());
            buffer.clear();
            inFlight = 0;
            flushing = false;
        }

        logger.atInfo().log("Flushing %d buffered feeds before shutdown", remaining.size());
        for (int start = 0; start < remaining.size(); start += batchSize) {
            ImmutableList<PriceFeed> feeds =
                remaining.subList(start, Math.min(start + batchSize, remaining.size()));
            IngestBatch batch = IngestBatch.create(workerId, clock.instant(), feeds);
            try {
                IngestResult result = client.deliver(batch);
                synchronized (lock) {
                    recordAcknowledged(batch, result);
                }
            } catch (DeliveryException | RuntimeException e) {
                synchronized (lock) {
                    recordDropped(batch.feeds(), "final flush failed", e);
                }
            }
        }
        logger.atInfo().log("Batch forwarder shut down: %s", stats());
    }

    @Override
    public ForwarderStats stats() {
        synchronized (lock) {
            return new ForwarderStats(
                feedsReceived, feedsIngested, feedsRejected, batchesSent, feedsDropped, buffer.size());
        }
    }

    private void startFlush() {
        if (flushing || stopped || buffer.isEmpty()) {
            return;
        }
        cancel(flushTimer);
        flushTimer = null;
        inFlight = Math.min(batchSize, buffer.size());
        ImmutableList<PriceFeed> feeds =
            buffer.subList(0, inFlight).stream().map(BufferedFeed::feed).collect(toImmutableList());
        IngestBatch batch = IngestBatch.create(workerId, clock.instant(), feeds);
        flushing = true;
        logger.atFine().log("Flushing batch of %d feeds (%d buffered)", inFlight, buffer.size());
        scheduler.execute(() -> deliver(batch, 0));
    }

    /**
     * Lets a delivery already running on the scheduler finish, so the final flush sends only what
     * that delivery did not carry. Called with the lock held.
     */
    private void awaitDeliveryInProgress() {
        long deadline = System.nanoTime() + IN_FLIGHT_SHUTDOWN_WAIT.toNanos();
        try {
            while (delivering) {
                long remainingNanos = deadline - System.nanoTime();
                if (remainingNanos <= 0) {
                    logger.atWarning().log(
                        "In-flight delivery still running after %s, its %d feeds are sent again",
                        IN_FLIGHT_SHUTDOWN_WAIT, inFlight);
                    return;
                }
                TimeUnit.NANOSECONDS.timedWait(lock, remainingNanos);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.atWarning().withCause(e).log(
                "Interrupted waiting for in-flight delivery, its %d feeds are sent again", inFlight);
        }
    }

    private void deliver(IngestBatch batch, int failures) {
        synchronized (lock) {
            if (stopped) {
                return;
            }
            delivering = true;
        }
        try {
            IngestResult result = client.deliver(batch);
            onAcknowledged(batch, result);
        } catch (DeliveryException | RuntimeException e) {
            onDeliveryFailed(batch, failures + 1, e);
        } finally {
            synchronized (lock) {
                delivering = false;
                lock.notifyAll();
            }
        }
    }

    private void onAcknowledged(IngestBatch batch, IngestResult result) {
        synchronized (lock) {
            if (finalFlushTaken) {
                return;
            }
            recordAcknowledged(batch, result);
            releaseInFlight();
        }
    }

    private void onDeliveryFailed(IngestBatch batch, int failures, Exception cause) {
        synchronized (lock) {
            if (stopped) {
                return;
            }
            if (failures > deliveryBackoff.maxAttempts()) {
                recordDropped(batch.feeds(),
                    String.format("delivery failed %d times", failures), cause);
                releaseInFlight();
                return;
            }
            Duration delay = deliveryBackoff.delayFor(failures);
            logger.atWarning().withCause(cause).log(
                "Delivery of %d feeds failed, retry %d/%d in %d ms",
                batch.feeds().size(), failures, deliveryBackoff.maxAttempts(), delay.toMillis());
            pendingRetry = scheduler.schedule(
                () -> deliver(batch, failures), delay.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    /** Removes the in-flight head, then flushes or re-arms the timer for what is left. */
    private void releaseInFlight() {
        buffer.subList(0, inFlight).clear();
        inFlight = 0;
        flushing = false;
        pendingRetry = null;
        if (stopped) {
            return;
        }
        if (buffer.size() >= batchSize) {
            startFlush();
        } else if (!buffer.isEmpty()) {
            Duration waited = Duration.between(buffer.get(0).arrivedAt(), clock.instant());
            Duration remaining = batchInterval.minus(waited);
            scheduleFlushTimer(remaining.isNegative() ? Duration.ZERO : remaining);
        }
    }

    private void scheduleFlushTimer(Duration delay) {
        cancel(flushTimer);
        flushTimer = scheduler.schedule(this::onFlushTimer, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void onFlushTimer() {
        synchronized (lock) {
            flushTimer = null;
            startFlush();
        }
    }

    private void evictOldestUnsent() {
        if (inFlight >= buffer.size()) {
            return;
        }
        BufferedFeed evicted = buffer.remove(inFlight);
        feedsDropped++;
        logger.atWarning().atMostEvery(10, TimeUnit.SECONDS).log(
            "Buffer ceiling %d reached, evicted oldest %s feed from %s (%d dropped so far)",
            bufferCeiling, evicted.feed().symbol(), evicted.feed().source(), feedsDropped);
    }

    private void recordAcknowledged(IngestBatch batch, IngestResult result) {
        batchesSent++;
        feedsIngested += result.ingested();
        feedsRejected += result.failed();
        if (result.failed() == 0) {
            logger.atFine().log("Batch of %d feeds ingested in %d ms",
                batch.feeds().size(), result.latency().toMillis());
            return;
        }
        logger.atWarning().log("Batch %s: %d ingested, %d rejected (%s) %s",
            result.status().wireName(), result.ingested(), result.failed(), result.message(),
            result.errors().stream().limit(5).map(IngestError::toString).collect(toImmutableList()));
    }

    private void recordDropped(List<PriceFeed> feeds, String reason, Exception cause) {
        feedsDropped += feeds.size();
        ImmutableSortedSet<String> symbols =
            feeds.stream().map(PriceFeed::symbol).collect(toImmutableSortedSet(Ordering.natural()));
        logger.atSevere().withCause(cause).log(
            "Dropped batch of %d feeds for %s: %s", feeds.size(), symbols, reason);
    }

    private static void cancel(ScheduledFuture<?> future) {
        if (future != null) {
            future.cancel(false);
        }
    }

    private record BufferedFeed(PriceFeed feed, Instant arrivedAt) {}
}
