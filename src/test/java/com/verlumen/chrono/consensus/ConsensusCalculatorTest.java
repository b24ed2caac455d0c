package com.verlumen.chrono.consensus;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.verlumen.chrono.marketdata.ConsensusRecord;
import com.verlumen.chrono.marketdata.PriceFeed;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ConsensusCalculatorTest {
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final String BTC_USD = "BTC/USD";

    @Inject private ConsensusCalculator calculator;

    @Before
    public void setUp() {
        Guice.createInjector().injectMembers(this);
    }

    @Test
    public void compute_threeSources_returnsMedianMeanAndStdDev() {
        // Arrange
        ImmutableList<PriceFeed> feeds = ImmutableList.of(
            feed(BTC_USD, "binance", NOW.minusSeconds(2), "101"),
            feed(BTC_USD, "coinbase", NOW.minusSeconds(1), "100"),
            feed(BTC_USD, "kraken", NOW, "102"));

        // Act
        Optional<ConsensusRecord> record = calculator.compute(BTC_USD, feeds, 1);

        // Assert
        assertThat(record).isPresent();
        assertThat(record.get().median()).isEqualTo(new BigDecimal("101"));
        assertThat(record.get().price()).isEqualTo(new BigDecimal("101"));
        assertThat(record.get().mean()).isEqualToIgnoringScale(new BigDecimal("101"));
        assertThat(record.get().stdDev().get().doubleValue()).isWithin(1e-9).of(0.816496580927726);
        assertThat(record.get().numSources()).isEqualTo(3);
        assertThat(record.get().sources()).containsExactly("binance", "coinbase", "kraken").inOrder();
        assertThat(record.get().timestamp()).isEqualTo(NOW);
    }

    @Test
    public void compute_fewerSourcesThanMinimum_returnsEmpty() {
        // Arrange
        ImmutableList<PriceFeed> feeds = ImmutableList.of(
            feed(BTC_USD, "coinbase", NOW.minusSeconds(1), "100"),
            feed(BTC_USD, "coinbase", NOW, "101"));

        // Act
        Optional<ConsensusRecord> record = calculator.compute(BTC_USD, feeds, 2);

        // Assert
        assertThat(record).isEmpty();
    }

    @Test
    public void compute_singleSource_hasNoStdDev() {
        // Act
        Optional<ConsensusRecord> record =
            calculator.compute(BTC_USD, ImmutableList.of(feed(BTC_USD, "coinbase", NOW, "64000.12")), 1);

        // Assert
        assertThat(record.get().median()).isEqualTo(new BigDecimal("64000.12"));
        assertThat(record.get().stdDev()).isEmpty();
    }

    @Test
    public void compute_usesOnlyLatestFeedPerSource() {
        // Arrange
        ImmutableList<PriceFeed> feeds = ImmutableList.of(
            feed(BTC_USD, "coinbase", NOW, "200"),
            feed(BTC_USD, "coinbase", NOW.minusSeconds(5), "100"),
            feed(BTC_USD, "kraken", NOW.minusSeconds(1), "202"));

        // Act
        ConsensusRecord record = calculator.compute(BTC_USD, feeds, 1).get();

        // Assert
        assertThat(record.numSources()).isEqualTo(2);
        assertThat(record.median()).isEqualTo(new BigDecimal("201"));
    }

    @Test
    public void compute_evenCount_medianIsExactMidpoint() {
        // Arrange
        ImmutableList<PriceFeed> feeds = ImmutableList.of(
            feed(BTC_USD, "a", NOW, "0.1"),
            feed(BTC_USD, "b", NOW, "0.2"),
            feed(BTC_USD, "c", NOW, "0.4"),
            feed(BTC_USD, "d", NOW, "0.9"));

        // Act
        ConsensusRecord record = calculator.compute(BTC_USD, feeds, 1).get();

        // Assert
        assertThat(record.median()).isEqualTo(new BigDecimal("0.3"));
        assertThat(record.mean()).isEqualToIgnoringScale(new BigDecimal("0.4"));
    }

    @Test
    public void compute_ignoresOtherSymbols() {
        // Arrange
        ImmutableList<PriceFeed> feeds = ImmutableList.of(
            feed(BTC_USD, "coinbase", NOW, "64000"),
            feed("ETH/USD", "kraken", NOW, "3100"));

        // Act
        ConsensusRecord record = calculator.compute(BTC_USD, feeds, 1).get();

        // Assert
        assertThat(record.sources()).containsExactly("coinbase");
    }

    @Test
    public void compute_noFeeds_returnsEmpty() {
        assertThat(calculator.compute(BTC_USD, ImmutableList.of(), 1)).isEmpty();
    }

    private static PriceFeed feed(String symbol, String source, Instant timestamp, String price) {
        return PriceFeed.builder()
            .setSymbol(symbol)
            .setPrice(new BigDecimal(price))
            .setTimestamp(timestamp)
            .setSource(source)
            .setWorkerId("worker-test")
            .build();
    }
}
