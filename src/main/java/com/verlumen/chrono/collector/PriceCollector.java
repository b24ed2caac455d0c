package com.verlumen.chrono.collector;

/** One worker: a connection per configured exchange feeding a shared batch forwarder. */
public interface PriceCollector {
    void start();

    void shutdown();

    CollectorStatus status();
}
