package com.verlumen.chrono.cache;

import com.google.common.collect.ImmutableSet;
import com.verlumen.chrono.marketdata.ConsensusRecord;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * One live consumer of consensus records. Records arrive in publish order through a bounded
 * queue; a consumer that lets the queue fill up is cut off.
 */
public final class Subscription implements AutoCloseable {
    private final ImmutableSet<String> symbols;
    private final BlockingQueue<ConsensusRecord> queue;
    private final Consumer<Subscription> onClose;
    private volatile boolean open = true;
    private volatile String closeReason = "";

    Subscription(ImmutableSet<String> symbols, int capacity, Consumer<Subscription> onClose) {
        this.symbols = symbols;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.onClose = onClose;
    }

    /**
     * Waits up to {@code timeout} for the next record. Returns empty on timeout, and immediately
     * once the subscription is closed and drained.
     */
    public Optional<ConsensusRecord> poll(Duration timeout) throws InterruptedException {
        ConsensusRecord record = queue.poll();
        if (record != null || !open) {
            return Optional.ofNullable(record);
        }
        return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    public boolean isOpen() {
        return open;
    }

    /** Empty while open; otherwise why the subscription ended. */
    public String closeReason() {
        return closeReason;
    }

    public ImmutableSet<String> symbols() {
        return symbols;
    }

    @Override
    public void close() {
        terminate("closed by subscriber");
        queue.clear();
    }

    boolean accepts(ConsensusRecord record) {
        return symbols.isEmpty() || symbols.contains(record.symbol());
    }

    /** Enqueues without blocking; false if the queue is full. */
    boolean offer(ConsensusRecord record) {
        return open && queue.offer(record);
    }

    void terminate(String reason) {
        if (!open) {
            return;
        }
        open = false;
        closeReason = reason;
        onClose.accept(this);
    }

    int pending() {
        return queue.size();
    }
}
