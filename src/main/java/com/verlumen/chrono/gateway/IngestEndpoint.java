package com.verlumen.chrono.gateway;

import com.google.common.flogger.FluentLogger;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.inject.Inject;
import com.verlumen.chrono.marketdata.IngestRequest;
import com.verlumen.chrono.marketdata.IngestResult;
import com.verlumen.chrono.marketdata.MarketDataJson;
import java.net.HttpURLConnection;

/**
 * Request handler for {@code POST /internal/ingest}, independent of any HTTP server.
 *
 * <p>Answers 200 when at least one feed was stored, 400 for bodies that cannot be read or batches
 * rejected whole, and 422 when every feed of a well-formed batch failed.
 */
public final class IngestEndpoint {
    private static final FluentLogger logger = FluentLogger.forEnclosingClass();
    public static final String PATH = "/internal/ingest";
    static final int HTTP_UNPROCESSABLE_ENTITY = 422;

    private final IngestionGateway gateway;

    @Inject
    IngestEndpoint(IngestionGateway gateway) {
        this.gateway = gateway;
    }

    public Reply handle(String body) {
        JsonObject json;
        try {
            JsonElement element = JsonParser.parseString(body);
            if (!element.isJsonObject()) {
                return badRequest(0, "Request body must be a JSON object");
            }
            json = element.getAsJsonObject();
        } catch (JsonParseException e) {
            logger.atWarning().withCause(e).log("Unreadable ingest request");
            return badRequest(0, "Invalid request: " + e.getMessage());
        }

        IngestRequest request;
        try {
            request = MarketDataJson.requestFromJson(json);
        } catch (JsonParseException e) {
            logger.atWarning().withCause(e).log("Malformed ingest request");
            return badRequest(feedCount(json), "Invalid request: " + e.getMessage());
        }

        IngestResult result = gateway.ingest(request);
        return new Reply(statusCode(result), MarketDataJson.toJson(result));
    }

    private static int feedCount(JsonObject json) {
        JsonElement feeds = json.get("feeds");
        return feeds != null && feeds.isJsonArray() ? feeds.getAsJsonArray().size() : 0;
    }

    private static int statusCode(IngestResult result) {
        if (result.ingested() > 0) {
            return HttpURLConnection.HTTP_OK;
        }
        return result.errors().isEmpty() ? HttpURLConnection.HTTP_BAD_REQUEST : HTTP_UNPROCESSABLE_ENTITY;
    }

    private static Reply badRequest(int submitted, String message) {
        JsonObject json = new JsonObject();
        json.addProperty("status", IngestResult.Status.ERROR.wireName());
        json.addProperty("ingested", 0);
        json.addProperty("failed", submitted);
        json.addProperty("latency_ms", 0);
        json.addProperty("message", message);
        return new Reply(HttpURLConnection.HTTP_BAD_REQUEST, json);
    }

    /** Status code and JSON body to send back. */
    public record Reply(int statusCode, JsonObject body) {}
}
