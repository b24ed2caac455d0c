package com.verlumen.chrono.exchanges;

import static com.verlumen.chrono.exchanges.JsonFields.optionalString;
import static com.verlumen.chrono.exchanges.JsonFields.putIfPresent;
import static com.verlumen.chrono.exchanges.JsonFields.requiredString;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.verlumen.chrono.instruments.CurrencyPair;
import com.verlumen.chrono.marketdata.PriceFeed;
import java.net.URI;
import java.time.Instant;
import java.util.Optional;

/**
 * Binance combined market streams, one {@code <symbol>@miniTicker} stream per configured pair.
 *
 * <p>Binance has no USD spot books; USD pairs are subscribed as USDT and reported back as USD.
 */
final class BinanceAdapter implements ExchangeAdapter {
    static final String NAME = "binance";
    private static final URI WEBSOCKET_URI = URI.create("wss://stream.binance.com:9443/stream");
    private static final String USD = "USD";
    private static final String USDT = "USDT";
    private static final String MINI_TICKER_EVENT = "24hrMiniTicker";
    private static final String TICKER_EVENT = "24hrTicker";

    private final ImmutableList<CurrencyPair> currencyPairs;
    private final String workerId;
    private final ImmutableMap<String, CurrencyPair> pairsByNativeSymbol;

    BinanceAdapter(ImmutableList<CurrencyPair> currencyPairs, String workerId) {
        this.currencyPairs = currencyPairs;
        this.workerId = workerId;
        ImmutableMap.Builder<String, CurrencyPair> pairs = ImmutableMap.builder();
        currencyPairs.forEach(pair -> pairs.put(nativeSymbol(pair), pair));
        this.pairsByNativeSymbol = pairs.buildKeepingLast();
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
        JsonObject request = new JsonObject();
        request.addProperty("method", "SUBSCRIBE");
        JsonArray params = new JsonArray();
        currencyPairs.forEach(pair -> params.add(Ascii.toLowerCase(nativeSymbol(pair)) + "@miniTicker"));
        request.add("params", params);
        request.addProperty("id", 1);
        return request.toString();
    }

    @Override
    public Optional<PriceFeed> parseMessage(String raw) throws MessageParseException {
        JsonElement element;
        try {
            element = JsonParser.parseString(raw);
        } catch (JsonParseException e) {
            throw new MessageParseException("Malformed JSON from Binance", e);
        }
        if (!element.isJsonObject()) {
            return Optional.empty();
        }

        JsonObject message = element.getAsJsonObject();
        JsonObject data;
        if (message.has("data") && message.get("data").isJsonObject()) {
            data = message.getAsJsonObject("data");
        } else if (message.has("e")) {
            data = message;
        } else {
            // Subscription acks ({"result":null,"id":1}) and anything else without an event.
            return Optional.empty();
        }

        String event = optionalString(data, "e").orElse("");
        if (!MINI_TICKER_EVENT.equals(event) && !TICKER_EVENT.equals(event)) {
            return Optional.empty();
        }

        String nativeSymbol = requiredString(data, "s");
        Instant timestamp;
        try {
            timestamp = Instant.ofEpochMilli(Long.parseLong(requiredString(data, "E")));
        } catch (NumberFormatException e) {
            throw new MessageParseException("Invalid event time in Binance ticker: " + data, e);
        }

        ImmutableMap.Builder<String, String> metadata = ImmutableMap.builder();
        putIfPresent(metadata, "open_price", optionalString(data, "o"));
        putIfPresent(metadata, "high_price", optionalString(data, "h"));
        putIfPresent(metadata, "low_price", optionalString(data, "l"));
        putIfPresent(metadata, "quote_volume", optionalString(data, "q"));
        putIfPresent(metadata, "price_change", optionalString(data, "p"));
        putIfPresent(metadata, "price_change_percent", optionalString(data, "P"));
        putIfPresent(metadata, "best_bid", optionalString(data, "b"));
        putIfPresent(metadata, "best_ask", optionalString(data, "a"));

        PriceFeed.Builder feed = PriceFeed.builder()
            .setSymbol(normalize(nativeSymbol))
            .setPrice(JsonFields.price(requiredString(data, "c")))
            .setTimestamp(timestamp)
            .setSource(NAME)
            .setWorkerId(workerId)
            .setMetadata(metadata.buildOrThrow());
        Optional<String> volume = optionalString(data, "v");
        if (volume.isPresent()) {
            feed.setVolume(JsonFields.volume(volume.get()));
        }
        return Optional.of(feed.build());
    }

    /**
     * Configured pairs are mapped exactly. Anything else quoted in USDT is reported as USD, which
     * is how Binance USD pairs are subscribed in the first place.
     */
    @Override
    public String normalizeSymbol(String nativeSymbol) {
        String upper = Ascii.toUpperCase(nativeSymbol);
        CurrencyPair configured = pairsByNativeSymbol.get(upper);
        if (configured != null) {
            return configured.symbol();
        }
        if (upper.endsWith(USDT) && upper.length() > USDT.length()) {
            return CurrencyPair.of(upper.substring(0, upper.length() - USDT.length()), USD).symbol();
        }
        throw new IllegalArgumentException("Cannot normalize Binance symbol: " + nativeSymbol);
    }

    private String normalize(String nativeSymbol) throws MessageParseException {
        try {
            return normalizeSymbol(nativeSymbol);
        } catch (IllegalArgumentException e) {
            throw new MessageParseException("Unknown Binance symbol: " + nativeSymbol, e);
        }
    }

    private static String nativeSymbol(CurrencyPair pair) {
        String quote = USD.equals(pair.counter().symbol()) ? USDT : pair.counter().symbol();
        return pair.base().symbol() + quote;
    }
}
