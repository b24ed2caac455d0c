package com.verlumen.chrono.exchanges;

import com.google.common.collect.ImmutableList;
import com.verlumen.chrono.instruments.CurrencyPair;
import com.verlumen.chrono.marketdata.PriceFeed;
import java.net.URI;
import java.util.Optional;

/**
 * Translates between one exchange's WebSocket protocol and canonical {@link PriceFeed}s.
 *
 * <p>Adapters hold only their construction-time configuration, so every method is safe to call
 * from any thread.
 */
public interface ExchangeAdapter {
    /** Exchange id used as the {@code source} of every feed, e.g. "coinbase". */
    String name();

    URI webSocketUri();

    ImmutableList<CurrencyPair> currencyPairs();

    /** The payload sent right after the connection opens. Depends only on the configured pairs. */
    String buildSubscription();

    /**
     * Normalizes one complete text frame.
     *
     * @return the feed, or empty for anything that is not a price update (acks, heartbeats, status
     *     events, messages of other channels)
     * @throws MessageParseException if the frame looks like a price update but cannot be read
     */
    Optional<PriceFeed> parseMessage(String raw) throws MessageParseException;

    /**
     * Maps an exchange-native symbol to canonical "BASE/QUOTE" form.
     *
     * @throws IllegalArgumentException if the symbol cannot be mapped
     */
    String normalizeSymbol(String nativeSymbol);

    interface Factory {
        /**
         * @throws com.verlumen.chrono.execution.ConfigurationException for an unknown exchange or
         *     an empty pair list
         */
        ExchangeAdapter create(String exchange, ImmutableList<CurrencyPair> pairs, String workerId);
    }
}
