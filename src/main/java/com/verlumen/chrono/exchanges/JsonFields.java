package com.verlumen.chrono.exchanges;

import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import java.math.BigDecimal;
import java.util.Optional;

/** Field access for exchange payloads, failing with {@link MessageParseException}. */
final class JsonFields {
    private JsonFields() {}

    static String requiredString(JsonObject json, String member) throws MessageParseException {
        JsonElement element = json.get(member);
        if (element == null || element.isJsonNull() || !element.isJsonPrimitive()) {
            throw new MessageParseException("Missing field '" + member + "' in " + json);
        }
        return element.getAsString();
    }

    static Optional<String> optionalString(JsonObject json, String member) {
        JsonElement element = json.get(member);
        if (element == null || element.isJsonNull() || !element.isJsonPrimitive()) {
            return Optional.empty();
        }
        return Optional.of(element.getAsString());
    }

    static String requiredString(JsonArray array, int index, String what) throws MessageParseException {
        if (array == null || array.size() <= index || !array.get(index).isJsonPrimitive()) {
            throw new MessageParseException("Missing " + what);
        }
        return array.get(index).getAsString();
    }

    static JsonArray optionalArray(JsonObject json, String member) {
        JsonElement element = json.get(member);
        return element != null && element.isJsonArray() ? element.getAsJsonArray() : null;
    }

    /** Parses a strictly positive price. */
    static BigDecimal price(String text) throws MessageParseException {
        BigDecimal price = decimal(text, "price");
        if (price.signum() <= 0) {
            throw new MessageParseException("Price must be positive: " + text);
        }
        return price;
    }

    /** Parses a volume, which may be zero but never negative. */
    static BigDecimal volume(String text) throws MessageParseException {
        BigDecimal volume = decimal(text, "volume");
        if (volume.signum() < 0) {
            throw new MessageParseException("Volume must not be negative: " + text);
        }
        return volume;
    }

    static void putIfPresent(
        ImmutableMap.Builder<String, String> metadata, String key, Optional<String> value) {
        value.ifPresent(v -> metadata.put(key, v));
    }

    private static BigDecimal decimal(String text, String what) throws MessageParseException {
        try {
            return new BigDecimal(text.trim());
        } catch (NumberFormatException e) {
            throw new MessageParseException("Invalid " + what + ": " + text, e);
        }
    }
}
