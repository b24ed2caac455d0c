package com.verlumen.chrono.cache;

import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import com.verlumen.chrono.marketdata.ConsensusRecord;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Fans consensus records out to live subscribers. Publishing never waits on a subscriber: a
 * subscriber whose queue is full is disconnected and its queue released.
 */
@Singleton
public final class PriceBroadcaster {
    private static final FluentLogger logger = FluentLogger.forEnclosingClass();
    public static final String QUEUE_CAPACITY = "broadcastQueueCapacity";

    private final int queueCapacity;
    private final Set<Subscription> subscriptions = new CopyOnWriteArraySet<>();

    @Inject
    PriceBroadcaster(@Named(QUEUE_CAPACITY) int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public Subscription subscribe(ImmutableSet<String> symbols) {
        Subscription subscription = new Subscription(symbols, queueCapacity, subscriptions::remove);
        subscriptions.add(subscription);
        logger.atInfo().log("New subscriber for %s (%d active)",
            symbols.isEmpty() ? "all symbols" : symbols, subscriptions.size());
        return subscription;
    }

    /** Serialized so that every subscriber sees records in the same order. */
    public synchronized void publish(ConsensusRecord record) {
        for (Subscription subscription : subscriptions) {
            if (!subscription.accepts(record)) {
                continue;
            }
            if (!subscription.offer(record)) {
                subscription.terminate("slow consumer");
                logger.atWarning().log(
                    "Disconnected slow subscriber for %s with %d undelivered records",
                    subscription.symbols(), subscription.pending());
            }
        }
    }

    public int subscriberCount() {
        return subscriptions.size();
    }
}
