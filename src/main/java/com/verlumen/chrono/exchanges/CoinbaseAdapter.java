package com.verlumen.chrono.exchanges;

import static com.verlumen.chrono.exchanges.JsonFields.optionalString;
import static com.verlumen.chrono.exchanges.JsonFields.putIfPresent;
import static com.verlumen.chrono.exchanges.JsonFields.requiredString;

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
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/** Coinbase Exchange ticker channel. Products are spelled "BTC-USD". */
final class CoinbaseAdapter implements ExchangeAdapter {
    private static final FluentLogger logger = FluentLogger.forEnclosingClass();
    static final String NAME = "coinbase";
    private static final URI WEBSOCKET_URI = URI.create("wss://ws-feed.exchange.coinbase.com");
    private static final String PRODUCT_DELIMITER = "-";

    private final ImmutableList<CurrencyPair> currencyPairs;
    private final String workerId;

    CoinbaseAdapter(ImmutableList<CurrencyPair> currencyPairs, String workerId) {
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
        subscribeMessage.addProperty("type", "subscribe");

        JsonArray productIds = new JsonArray();
        currencyPairs.forEach(pair -> productIds.add(pair.symbol(PRODUCT_DELIMITER)));
        subscribeMessage.add("product_ids", productIds);

        JsonArray channels = new JsonArray();
        channels.add("ticker");
        subscribeMessage.add("channels", channels);
        return subscribeMessage.toString();
    }

    @Override
    public Optional<PriceFeed> parseMessage(String raw) throws MessageParseException {
        JsonElement element;
        try {
            element = JsonParser.parseString(raw);
        } catch (JsonParseException e) {
            throw new MessageParseException("Malformed JSON from Coinbase", e);
        }
        if (!element.isJsonObject()) {
            return Optional.empty();
        }

        JsonObject message = element.getAsJsonObject();
        String type = optionalString(message, "type").orElse("");
        if ("error".equals(type)) {
            logger.atWarning().log("Coinbase reported an error: %s", message);
            return Optional.empty();
        }
        if (!"ticker".equals(type)) {
            logger.atFiner().log("Ignoring Coinbase message of type '%s'", type);
            return Optional.empty();
        }

        String productId = requiredString(message, "product_id");
        Instant timestamp;
        try {
            timestamp = Instant.parse(requiredString(message, "time"));
        } catch (DateTimeParseException e) {
            throw new MessageParseException("Invalid time in Coinbase ticker: " + message, e);
        }

        ImmutableMap.Builder<String, String> metadata = ImmutableMap.builder();
        putIfPresent(metadata, "sequence", optionalString(message, "sequence"));
        putIfPresent(metadata, "trade_id", optionalString(message, "trade_id"));
        putIfPresent(metadata, "best_bid", optionalString(message, "best_bid"));
        putIfPresent(metadata, "best_ask", optionalString(message, "best_ask"));

        PriceFeed.Builder feed = PriceFeed.builder()
            .setSymbol(normalize(productId))
            .setPrice(JsonFields.price(requiredString(message, "price")))
            .setTimestamp(timestamp)
            .setSource(NAME)
            .setWorkerId(workerId)
            .setMetadata(metadata.buildOrThrow());
        Optional<String> volume = optionalString(message, "volume_24h");
        if (volume.isPresent()) {
            feed.setVolume(JsonFields.volume(volume.get()));
        }
        return Optional.of(feed.build());
    }

    @Override
    public String normalizeSymbol(String nativeSymbol) {
        return CurrencyPair.fromSymbol(nativeSymbol).symbol();
    }

    private String normalize(String productId) throws MessageParseException {
        try {
            return normalizeSymbol(productId);
        } catch (IllegalArgumentException e) {
            throw new MessageParseException("Unknown Coinbase product: " + productId, e);
        }
    }
}
