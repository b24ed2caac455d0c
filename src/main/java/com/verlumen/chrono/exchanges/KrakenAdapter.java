package com.verlumen.chrono.exchanges;

import static com.verlumen.chrono.exchanges.JsonFields.optionalArray;
import static com.verlumen.chrono.exchanges.JsonFields.optionalString;
import static com.verlumen.chrono.exchanges.JsonFields.requiredString;

import com.google.common.collect.ImmutableBiMap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.verlumen.chrono.instruments.CurrencyPair;
import com.verlumen.chrono.marketdata.PriceFeed;
import java.net.URI;
import java.time.Clock;
import java.util.Optional;

/**
 * Kraken public ticker channel. Ticker frames are arrays shaped
 * {@code [channelId, data, "ticker", "XBT/USD"]} and carry no timestamp, so feeds are stamped
 * with the receive time.
 */
final class KrakenAdapter implements ExchangeAdapter {
    private static final FluentLogger logger = FluentLogger.forEnclosingClass();
    static final String NAME = "kraken";
    private static final URI WEBSOCKET_URI = URI.create("wss://ws.kraken.com");
    private static final String TICKER_CHANNEL = "ticker";

    /** Canonical ticker to Kraken's spelling. */
    private static final ImmutableBiMap<String, String> KRAKEN_TICKERS =
        ImmutableBiMap.of("BTC", "XBT", "DOGE", "XDG");

    private final Clock clock;
    private final ImmutableList<CurrencyPair> currencyPairs;
    private final String workerId;

    KrakenAdapter(Clock clock, ImmutableList<CurrencyPair> currencyPairs, String workerId) {
        this.clock = clock;
        this.currencyPairs = currencyPairs;
        this.workerId = workerId;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public URI webSocketUri() {
        return WEBSOCKET_URI;
    }

    @Override
    public ImmutableList<CurrencyPair> currencyPairs() {
        return currencyPairs;
    }

    @Override
    public String buildSubscription() {
        JsonObject subscribeMessage = new JsonObject();
        subscribeMessage.addProperty("event", "subscribe");

        JsonArray pairs = new JsonArray();
        currencyPairs.forEach(pair -> pairs.add(
            toKraken(pair.base().symbol()) + "/" + toKraken(pair.counter().symbol())));
        subscribeMessage.add("pair", pairs);

        JsonObject subscription = new JsonObject();
        subscription.addProperty("name", TICKER_CHANNEL);
        subscribeMessage.add("subscription", subscription);
        return subscribeMessage.toString();
    }

    @Override
    public Optional<PriceFeed> parseMessage(String raw) throws MessageParseException {
        JsonElement element;
        try {
            element = JsonParser.parseString(raw);
        } catch (JsonParseException e) {
            throw new MessageParseException("Malformed JSON from Kraken", e);
        }

        if (element.isJsonObject()) {
            JsonObject event = element.getAsJsonObject();
            if ("subscriptionStatus".equals(optionalString(event, "event").orElse(""))
                && "error".equals(optionalString(event, "status").orElse(""))) {
                logger.atWarning().log("Kraken rejected a subscription: %s", event);
            }
            return Optional.empty();
        }
        if (!element.isJsonArray()) {
            return Optional.empty();
        }

        JsonArray frame = element.getAsJsonArray();
        if (frame.size() != 4
            || !frame.get(2).isJsonPrimitive()
            || !TICKER_CHANNEL.equals(frame.get(2).getAsString())) {
            return Optional.empty();
        }
        if (!frame.get(1).isJsonObject()) {
            throw new MessageParseException("Kraken ticker without data: " + raw);
        }

        JsonObject data = frame.get(1).getAsJsonObject();
        String pair = requiredString(frame, 3, "pair in Kraken ticker");
        String price = requiredString(optionalArray(data, "c"), 0, "last trade price in Kraken ticker");

        ImmutableMap.Builder<String, String> metadata = ImmutableMap.builder();
        metadata.put("channel_id", frame.get(0).isJsonPrimitive() ? frame.get(0).getAsString() : "");
        putElement(metadata, "ask", optionalArray(data, "a"), 0);
        putElement(metadata, "bid", optionalArray(data, "b"), 0);
        putElement(metadata, "high_24h", optionalArray(data, "h"), 1);
        putElement(metadata, "low_24h", optionalArray(data, "l"), 1);
        putElement(metadata, "vwap_24h", optionalArray(data, "p"), 1);
        putElement(metadata, "trades_24h", optionalArray(data, "t"), 1);
        putElement(metadata, "open_today", optionalArray(data, "o"), 0);

        PriceFeed.Builder feed = PriceFeed.builder()
            .setSymbol(normalize(pair))
            .setPrice(JsonFields.price(price))
            .setTimestamp(clock.instant())
            .setSource(NAME)
            .setWorkerId(workerId)
            .setMetadata(metadata.buildOrThrow());
        JsonArray volume = optionalArray(data, "v");
        if (volume != null && volume.size() > 1) {
            feed.setVolume(JsonFields.volume(volume.get(1).getAsString()));
        }
        return Optional.of(feed.build());
    }

    @Override
    public String normalizeSymbol(String nativeSymbol) {
        CurrencyPair pair = CurrencyPair.fromSymbol(nativeSymbol);
        return CurrencyPair.of(fromKraken(pair.base().symbol()), fromKraken(pair.counter().symbol()))
            .symbol();
    }

    private String normalize(String pair) throws MessageParseException {
        try {
            return normalizeSymbol(pair);
        } catch (IllegalArgumentException e) {
            throw new MessageParseException("Unknown Kraken pair: " + pair, e);
        }
    }

    private static String toKraken(String ticker) {
        return KRAKEN_TICKERS.getOrDefault(ticker, ticker);
    }

    private static String fromKraken(String ticker) {
        return KRAKEN_TICKERS.inverse().getOrDefault(ticker, ticker);
    }

    private static void putElement(
        ImmutableMap.Builder<String, String> metadata, String key, JsonArray values, int index) {
        if (values != null && values.size() > index && values.get(index).isJsonPrimitive()) {
            metadata.put(key, values.get(index).getAsString());
        }
    }
}
