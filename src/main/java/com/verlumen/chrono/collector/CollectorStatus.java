package com.verlumen.chrono.collector;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import java.time.Duration;
import java.util.Comparator;

/** Status snapshot of a collector worker, one entry per exchange connection. */
public record CollectorStatus(
    String workerId,
    ImmutableList<String> symbols,
    ImmutableList<ConnectionStats> connections,
    ForwarderStats forwarder) {

  /**
   * The least healthy connection state, so a single failed exchange is visible at the top level.
   */
  public ConnectionState state() {
    return connections.stream()
        .map(ConnectionStats::state)
        .max(Comparator.comparingInt(CollectorStatus::severity))
        .orElse(ConnectionState.DISCONNECTED);
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    json.addProperty("worker_id", workerId);
    json.addProperty("state", state().wireName());
    JsonArray symbolArray = new JsonArray();
    symbols.forEach(symbolArray::add);
    json.add("symbols", symbolArray);

    JsonArray exchanges = new JsonArray();
    for (ConnectionStats stats : connections) {
      JsonObject exchange = new JsonObject();
      exchange.addProperty("exchange", stats.exchange());
      exchange.addProperty("state", stats.state().wireName());
      exchange.addProperty("uptime_seconds", stats.uptime().getSeconds());
      exchange.addProperty("reconnect_attempts", stats.reconnectAttempts());
      exchange.addProperty("feeds_parsed", stats.feedsParsed());
      exchange.addProperty("parse_failures", stats.parseFailures());
      stats.lastError().ifPresent(error -> exchange.addProperty("last_error", error));
      exchanges.add(exchange);
    }
    json.add("exchanges", exchanges);

    json.addProperty("uptime_seconds", connections.stream()
        .map(ConnectionStats::uptime).max(Comparator.naturalOrder()).orElse(Duration.ZERO).getSeconds());
    json.addProperty("feeds_collected", forwarder.feedsReceived());
    json.addProperty("batches_sent", forwarder.batchesSent());
    json.addProperty("feeds_dropped", forwarder.feedsDropped());
    return json;
  }

  private static int severity(ConnectionState state) {
    switch (state) {
      case CONNECTED:
        return 0;
      case CONNECTING:
        return 1;
      case RECONNECTING:
        return 2;
      case DISCONNECTED:
        return 3;
      case FAILED:
        return 4;
    }
    throw new AssertionError(state);
  }
}
