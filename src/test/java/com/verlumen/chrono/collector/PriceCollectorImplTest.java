package com.verlumen.chrono.collector;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.testing.fieldbinder.Bind;
import com.google.inject.testing.fieldbinder.BoundFieldModule;
import com.verlumen.chrono.exchanges.ExchangeAdapter;
import com.verlumen.chrono.execution.ConfigurationException;
import com.verlumen.chrono.marketdata.PriceFeed;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Consumer;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

@RunWith(JUnit4.class)
public class PriceCollectorImplTest {
  @Rule public MockitoRule mockito = MockitoJUnit.rule();

  @Mock @Bind private ExchangeAdapter.Factory mockAdapterFactory;
  @Mock @Bind private ConnectionManager.Factory mockConnectionManagerFactory;
  @Mock @Bind private BatchForwarder mockForwarder;
  @Mock private ExchangeAdapter mockCoinbaseAdapter;
  @Mock private ExchangeAdapter mockKrakenAdapter;
  @Mock private ConnectionManager mockCoinbaseConnection;
  @Mock private ConnectionManager mockKrakenConnection;

  @Bind private CollectorConfig config = CollectorConfig.builder()
      .setWorkerId("worker-multi-us")
      .setExchanges(ImmutableList.of("coinbase", "kraken"))
      .setIngestMode(IngestMode.LOCAL)
      .build();

  @Inject private PriceCollectorImpl collector;

  @Before
  public void setUp() {
    Guice.createInjector(BoundFieldModule.of(this)).injectMembers(this);
    when(mockAdapterFactory.create(eq("coinbase"), any(), anyString())).thenReturn(mockCoinbaseAdapter);
    when(mockAdapterFactory.create(eq("kraken"), any(), anyString())).thenReturn(mockKrakenAdapter);
    when(mockConnectionManagerFactory.create(eq(mockCoinbaseAdapter), any()))
        .thenReturn(mockCoinbaseConnection);
    when(mockConnectionManagerFactory.create(eq(mockKrakenAdapter), any()))
        .thenReturn(mockKrakenConnection);
  }

  @Test
  public void start_connectsEveryConfiguredExchange() {
    // Act
    collector.start();

    // Assert
    verify(mockAdapterFactory).create("coinbase", config.currencyPairs(), "worker-multi-us");
    verify(mockAdapterFactory).create("kraken", config.currencyPairs(), "worker-multi-us");
    verify(mockCoinbaseConnection).connect();
    verify(mockKrakenConnection).connect();
  }

  @Test
  @SuppressWarnings("unchecked")
  public void start_connectionSinkForwardsFeeds() {
    // Arrange
    ArgumentCaptor<Consumer<PriceFeed>> sinkCaptor = ArgumentCaptor.forClass(Consumer.class);
    PriceFeed feed = PriceFeed.builder()
        .setSymbol("BTC/USD")
        .setPrice(new BigDecimal("64000"))
        .setTimestamp(Instant.parse("2024-05-01T12:00:00Z"))
        .setSource("coinbase")
        .setWorkerId("worker-multi-us")
        .build();

    // Act
    collector.start();

    // Assert
    verify(mockConnectionManagerFactory).create(eq(mockCoinbaseAdapter), sinkCaptor.capture());
    sinkCaptor.getValue().accept(feed);
    verify(mockForwarder).add(feed);
  }

  @Test
  public void start_unknownExchange_connectsNothing() {
    // Arrange
    when(mockAdapterFactory.create(eq("kraken"), any(), anyString()))
        .thenThrow(new ConfigurationException("Unsupported exchange 'kraken'"));

    // Act & Assert
    assertThrows(ConfigurationException.class, () -> collector.start());
    verify(mockCoinbaseConnection, never()).connect();
  }

  @Test
  public void shutdown_flushesForwarderBeforeClosingConnections() {
    // Arrange
    collector.start();

    // Act
    collector.shutdown();

    // Assert
    InOrder inOrder = inOrder(mockForwarder, mockCoinbaseConnection, mockKrakenConnection);
    inOrder.verify(mockForwarder).shutdown();
    inOrder.verify(mockCoinbaseConnection).disconnect();
    inOrder.verify(mockKrakenConnection).disconnect();
  }

  @Test
  public void status_reportsWorstConnectionState() {
    // Arrange
    collector.start();
    when(mockCoinbaseConnection.stats()).thenReturn(new ConnectionStats(
        "coinbase", ConnectionState.CONNECTED, 0, Duration.ofMinutes(3), 120, 0, Optional.empty()));
    when(mockKrakenConnection.stats()).thenReturn(new ConnectionStats(
        "kraken", ConnectionState.RECONNECTING, 2, Duration.ZERO, 40, 1, Optional.of("reset")));
    when(mockForwarder.stats()).thenReturn(new ForwarderStats(160, 150, 0, 2, 0, 10));

    // Act
    CollectorStatus status = collector.status();

    // Assert
    assertThat(status.state()).isEqualTo(ConnectionState.RECONNECTING);
    assertThat(status.symbols()).containsExactly("BTC/USD", "ETH/USD").inOrder();
    assertThat(status.toJson().get("feeds_collected").getAsLong()).isEqualTo(160);
    assertThat(status.toJson().get("uptime_seconds").getAsLong()).isEqualTo(180);
    assertThat(status.toJson().getAsJsonArray("exchanges").get(1).getAsJsonObject()
        .get("last_error").getAsString()).isEqualTo("reset");
  }
}
