package com.verlumen.chrono.collector;

import com.verlumen.chrono.exchanges.ExchangeAdapter;
import com.verlumen.chrono.marketdata.PriceFeed;
import java.util.function.Consumer;

/**
 * Owns one WebSocket connection to one exchange and drives its connect/retry state machine.
 *
 * <p>Normalized feeds are handed to the sink the manager was created with. Parse failures are
 * logged and counted and never change the connection state.
 */
public interface ConnectionManager {
    /** Opens the connection. A no-op while connecting or connected. */
    void connect();

    /** Cancels any pending retry, closes the transport and settles in DISCONNECTED. Idempotent. */
    void disconnect();

    ConnectionState state();

    ConnectionStats stats();

    interface Factory {
        ConnectionManager create(ExchangeAdapter adapter, Consumer<PriceFeed> feedSink);
    }
}
