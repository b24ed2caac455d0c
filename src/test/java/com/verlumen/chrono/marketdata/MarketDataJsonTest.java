package com.verlumen.chrono.marketdata;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class MarketDataJsonTest {
    private static final Instant TIMESTAMP = Instant.parse("2024-05-01T12:00:00.123Z");

    @Test
    public void toJson_feed_writesDecimalsAsPlainStrings() {
        // Arrange
        PriceFeed feed = PriceFeed.builder()
            .setSymbol("BTC/USD")
            .setPrice(new BigDecimal("1E+5"))
            .setVolume(new BigDecimal("0.00000001"))
            .setTimestamp(TIMESTAMP)
            .setSource("coinbase")
            .setWorkerId("worker-coinbase-us")
            .build();

        // Act
        JsonObject json = MarketDataJson.toJson(feed);

        // Assert
        assertThat(json.get("price").getAsJsonPrimitive().isString()).isTrue();
        assertThat(json.get("price").getAsString()).isEqualTo("100000");
        assertThat(json.get("volume").getAsString()).isEqualTo("0.00000001");
        assertThat(json.get("timestamp").getAsString()).isEqualTo("2024-05-01T12:00:00.123Z");
        assertThat(json.has("metadata")).isFalse();
    }

    @Test
    public void requestFromJson_readsFeedsWithBatchWorkerId() {
        // Arrange
        String body = """
            {
              "worker_id": "worker-kraken-eu",
              "timestamp": "2024-05-01T12:00:01Z",
              "feeds": [
                {"symbol": "BTC/USD", "price": "64000.12345678", "source": "kraken",
                 "timestamp": "2024-05-01T12:00:00Z", "metadata": {"channel_id": 42}},
                {"symbol": "ETH/USD", "price": 3100.5, "volume": null, "source": "kraken",
                 "timestamp": "2024-05-01T12:00:00Z"}
              ]
            }
            """;

        // Act
        IngestRequest request = MarketDataJson.requestFromJson(JsonParser.parseString(body).getAsJsonObject());

        // Assert
        assertThat(request.workerId()).isEqualTo("worker-kraken-eu");
        assertThat(request.size()).isEqualTo(2);
        PriceFeed first = request.entries().get(0).feed().get();
        assertThat(first.price()).isEqualTo(new BigDecimal("64000.12345678"));
        assertThat(first.workerId()).isEqualTo("worker-kraken-eu");
        assertThat(first.metadata()).containsExactly("channel_id", "42");
        PriceFeed second = request.entries().get(1).feed().get();
        assertThat(second.price()).isEqualTo(new BigDecimal("3100.5"));
        assertThat(second.volume()).isEmpty();
    }

    @Test
    public void requestFromJson_unreadableFeed_keepsItsSlot() {
        // Arrange
        String body = """
            {"worker_id": "w", "timestamp": "2024-05-01T12:00:01Z",
             "feeds": [{"symbol": "BTC/USD", "price": "abc", "source": "x",
                        "timestamp": "2024-05-01T12:00:00Z"},
                       {"symbol": "ETH/USD", "price": "3100", "source": "x",
                        "timestamp": "2024-05-01T12:00:00Z"}]}
            """;

        // Act
        IngestRequest request = MarketDataJson.requestFromJson(JsonParser.parseString(body).getAsJsonObject());

        // Assert
        IngestRequest.Entry unreadable = request.entries().get(0);
        assertThat(unreadable.feed()).isEmpty();
        assertThat(unreadable.symbol()).isEqualTo("BTC/USD");
        assertThat(unreadable.error()).isEqualTo("Invalid decimal for price: abc");
        assertThat(request.entries().get(1).feed()).isPresent();
    }

    @Test
    public void feedFromJson_rejectsExponentAndPaddedDecimals(
            @TestParameter({"1E+3", " 5 ", "-5", "5.", ".5"}) String price) {
        // Arrange
        JsonObject json = new JsonObject();
        json.addProperty("symbol", "BTC/USD");
        json.addProperty("price", price);
        json.addProperty("source", "coinbase");
        json.addProperty("timestamp", "2024-05-01T12:00:00Z");

        // Act
        JsonParseException thrown =
            assertThrows(JsonParseException.class, () -> MarketDataJson.feedFromJson(json, "w"));

        // Assert
        assertThat(thrown).hasMessageThat().isEqualTo("Invalid decimal for price: " + price);
    }

    @Test
    public void requestFromJson_missingFeeds_throws() {
        JsonObject json = JsonParser.parseString(
            "{\"worker_id\": \"w\", \"timestamp\": \"2024-05-01T12:00:01Z\"}").getAsJsonObject();

        assertThrows(JsonParseException.class, () -> MarketDataJson.requestFromJson(json));
    }

    @Test
    public void resultFromJson_readsItemizedErrors() {
        // Arrange
        IngestResult result = new IngestResult(
            IngestResult.Status.PARTIAL,
            1,
            1,
            Duration.ofMillis(12),
            "1 of 2 price feeds ingested",
            ImmutableList.of(new IngestError(1, "bad", "Symbol must be in format BASE/QUOTE (e.g., BTC/USD)")));

        // Act
        IngestResult parsed = MarketDataJson.resultFromJson(MarketDataJson.toJson(result));

        // Assert
        assertThat(parsed).isEqualTo(result);
    }

    @Test
    public void toJson_consensus_omitsAbsentStdDev() {
        // Arrange
        ConsensusRecord record = ConsensusRecord.builder()
            .setSymbol("ETH/USD")
            .setMedian(new BigDecimal("3000.5"))
            .setMean(new BigDecimal("3000.5"))
            .setTimestamp(TIMESTAMP)
            .setSources(ImmutableList.of("binance"))
            .build();

        // Act
        JsonObject json = MarketDataJson.toJson(record);

        // Assert
        assertThat(json.get("price").getAsString()).isEqualTo("3000.5");
        assertThat(json.get("num_sources").getAsInt()).isEqualTo(1);
        assertThat(json.has("std_dev")).isFalse();
    }

    @Test
    public void priceFeed_metadataDefaultsToEmpty() {
        PriceFeed feed = PriceFeed.builder()
            .setSymbol("BTC/USD")
            .setPrice(BigDecimal.ONE)
            .setTimestamp(TIMESTAMP)
            .setSource("binance")
            .setWorkerId("w")
            .build();

        assertThat(feed.metadata()).isEqualTo(ImmutableMap.of());
        assertThat(feed.key()).isEqualTo(new PriceFeed.FeedKey("BTC/USD", "binance", TIMESTAMP));
    }
}
