package com.verlumen.chrono.marketdata;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * JSON wire format shared by the ingestion boundary and the read boundary.
 *
 * <p>Decimals are always written as plain strings and instants as ISO-8601 strings so no value
 * passes through a binary float on the way out.
 */
public final class MarketDataJson {
    /** Unsigned decimal without exponent or padding, as prices and volumes travel on the wire. */
    private static final Pattern PLAIN_DECIMAL = Pattern.compile("^\\d+(\\.\\d+)?$");

    private MarketDataJson() {}

    public static JsonObject toJson(PriceFeed feed) {
        JsonObject json = new JsonObject();
        json.addProperty("symbol", feed.symbol());
        json.addProperty("price", decimal(feed.price()));
        feed.volume().ifPresent(volume -> json.addProperty("volume", decimal(volume)));
        json.addProperty("source", feed.source());
        json.addProperty("timestamp", feed.timestamp().toString());
        if (!feed.metadata().isEmpty()) {
            JsonObject metadata = new JsonObject();
            feed.metadata().forEach(metadata::addProperty);
            json.add("metadata", metadata);
        }
        return json;
    }

    /**
     * Reads one feed of an ingest request. Range checks are left to the gateway; only values that
     * cannot be represented at all are rejected here.
     *
     * @throws JsonParseException if a required member is missing or not of a usable type
     */
    public static PriceFeed feedFromJson(JsonObject json, String workerId) {
        PriceFeed.Builder builder = PriceFeed.builder()
            .setSymbol(requiredString(json, "symbol"))
            .setPrice(requiredDecimal(json, "price"))
            .setSource(requiredString(json, "source"))
            .setTimestamp(requiredInstant(json, "timestamp"))
            .setWorkerId(workerId);
        if (json.has("volume") && !json.get("volume").isJsonNull()) {
            builder.setVolume(requiredDecimal(json, "volume"));
        }
        if (json.has("metadata") && json.get("metadata").isJsonObject()) {
            ImmutableMap.Builder<String, String> metadata = ImmutableMap.builder();
            for (Map.Entry<String, JsonElement> entry : json.getAsJsonObject("metadata").entrySet()) {
                if (!entry.getValue().isJsonNull()) {
                    metadata.put(entry.getKey(), stringValue(entry.getValue()));
                }
            }
            builder.setMetadata(metadata.buildKeepingLast());
        }
        return builder.build();
    }

    public static JsonObject toJson(IngestBatch batch) {
        JsonObject json = new JsonObject();
        json.addProperty("worker_id", batch.workerId());
        json.addProperty("timestamp", batch.timestamp().toString());
        JsonArray feeds = new JsonArray();
        batch.feeds().forEach(feed -> feeds.add(toJson(feed)));
        json.add("feeds", feeds);
        return json;
    }

    /**
     * Reads an ingest request. Feeds that cannot be read become unreadable entries at their index.
     *
     * @throws JsonParseException if the batch timestamp or the feeds array is missing or invalid
     */
    public static IngestRequest requestFromJson(JsonObject json) {
        String workerId = json.has("worker_id") && !json.get("worker_id").isJsonNull()
            ? stringValue(json.get("worker_id"))
            : "";
        Instant timestamp = requiredInstant(json, "timestamp");
        if (!json.has("feeds") || !json.get("feeds").isJsonArray()) {
            throw new JsonParseException("Missing feeds array");
        }
        ImmutableList.Builder<IngestRequest.Entry> entries = ImmutableList.builder();
        for (JsonElement element : json.getAsJsonArray("feeds")) {
            entries.add(entryFromJson(element, workerId));
        }
        return new IngestRequest(workerId, timestamp, entries.build());
    }

    private static IngestRequest.Entry entryFromJson(JsonElement element, String workerId) {
        if (!element.isJsonObject()) {
            return IngestRequest.Entry.unreadable("", "Feed entries must be objects");
        }
        JsonObject json = element.getAsJsonObject();
        try {
            return IngestRequest.Entry.readable(feedFromJson(json, workerId));
        } catch (JsonParseException e) {
            JsonElement symbol = json.get("symbol");
            return IngestRequest.Entry.unreadable(
                symbol != null && symbol.isJsonPrimitive() ? symbol.getAsString() : "", e.getMessage());
        }
    }

    public static JsonObject toJson(IngestResult result) {
        JsonObject json = new JsonObject();
        json.addProperty("status", result.status().wireName());
        json.addProperty("ingested", result.ingested());
        json.addProperty("failed", result.failed());
        json.addProperty("latency_ms", result.latency().toMillis());
        json.addProperty("message", result.message());
        if (!result.errors().isEmpty()) {
            JsonArray errors = new JsonArray();
            for (IngestError error : result.errors()) {
                JsonObject item = new JsonObject();
                item.addProperty("index", error.index());
                item.addProperty("symbol", error.symbol());
                item.addProperty("error", error.reason());
                errors.add(item);
            }
            json.add("errors", errors);
        }
        return json;
    }

    /** @throws JsonParseException if the response does not carry the ingest result members */
    public static IngestResult resultFromJson(JsonObject json) {
        try {
            ImmutableList.Builder<IngestError> errors = ImmutableList.builder();
            if (json.has("errors") && json.get("errors").isJsonArray()) {
                for (JsonElement element : json.getAsJsonArray("errors")) {
                    JsonObject item = element.getAsJsonObject();
                    errors.add(new IngestError(
                        item.get("index").getAsInt(),
                        stringValue(item.get("symbol")),
                        stringValue(item.get("error"))));
                }
            }
            return new IngestResult(
                IngestResult.Status.fromWireName(requiredString(json, "status")),
                json.get("ingested").getAsInt(),
                json.get("failed").getAsInt(),
                Duration.ofMillis(json.has("latency_ms") ? json.get("latency_ms").getAsLong() : 0),
                json.has("message") ? stringValue(json.get("message")) : "",
                errors.build());
        } catch (IllegalArgumentException | IllegalStateException | NullPointerException e) {
            throw new JsonParseException("Malformed ingest result: " + json, e);
        }
    }

    public static JsonObject toJson(ConsensusRecord record) {
        JsonObject json = new JsonObject();
        json.addProperty("symbol", record.symbol());
        json.addProperty("price", decimal(record.price()));
        json.addProperty("median", decimal(record.median()));
        json.addProperty("mean", decimal(record.mean()));
        record.stdDev().ifPresent(stdDev -> json.addProperty("std_dev", decimal(stdDev)));
        json.addProperty("num_sources", record.numSources());
        json.addProperty("timestamp", record.timestamp().toString());
        JsonArray sources = new JsonArray();
        record.sources().forEach(sources::add);
        json.add("sources", sources);
        return json;
    }

    public static JsonObject toJson(OhlcvBar bar) {
        JsonObject json = new JsonObject();
        json.addProperty("symbol", bar.symbol());
        json.addProperty("time", bar.start().toString());
        json.addProperty("open", decimal(bar.open()));
        json.addProperty("high", decimal(bar.high()));
        json.addProperty("low", decimal(bar.low()));
        json.addProperty("close", decimal(bar.close()));
        json.addProperty("volume", decimal(bar.volume()));
        json.addProperty("count", bar.count());
        return json;
    }

    public static String decimal(BigDecimal value) {
        return value.toPlainString();
    }

    private static String requiredString(JsonObject json, String member) {
        JsonElement element = json.get(member);
        if (element == null || element.isJsonNull() || !element.isJsonPrimitive()) {
            throw new JsonParseException("Missing or invalid " + member);
        }
        return element.getAsString();
    }

    private static BigDecimal requiredDecimal(JsonObject json, String member) {
        String text = requiredString(json, member);
        if (!PLAIN_DECIMAL.matcher(text).matches()) {
            throw new JsonParseException("Invalid decimal for " + member + ": " + text);
        }
        return new BigDecimal(text);
    }

    private static Instant requiredInstant(JsonObject json, String member) {
        String text = requiredString(json, member);
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            throw new JsonParseException("Invalid timestamp for " + member + ": " + text, e);
        }
    }

    private static String stringValue(JsonElement element) {
        return element.isJsonPrimitive() ? element.getAsString() : element.toString();
    }
}
