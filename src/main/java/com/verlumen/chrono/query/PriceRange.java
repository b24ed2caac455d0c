package com.verlumen.chrono.query;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.verlumen.chrono.marketdata.MarketDataJson;
import com.verlumen.chrono.marketdata.OhlcvBar;
import com.verlumen.chrono.marketdata.PriceFeed;
import java.util.Optional;

/** Answer to a range query: raw feeds newest first, or OHLCV bars oldest first when an interval was given. */
public record PriceRange(
    String symbol,
    Optional<Interval> interval,
    ImmutableList<PriceFeed> feeds,
    ImmutableList<OhlcvBar> bars) {

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    json.addProperty("symbol", symbol);
    JsonArray data = new JsonArray();
    if (interval.isPresent()) {
      json.addProperty("interval", interval.get().label());
      bars.forEach(bar -> data.add(MarketDataJson.toJson(bar)));
    } else {
      feeds.forEach(feed -> data.add(MarketDataJson.toJson(feed)));
    }
    json.add("data", data);
    json.addProperty("count", data.size());
    return json;
  }
}
