package com.verlumen.chrono.exchanges;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.testing.fieldbinder.Bind;
import com.google.inject.testing.fieldbinder.BoundFieldModule;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import com.verlumen.chrono.execution.ConfigurationException;
import com.verlumen.chrono.instruments.CurrencyPair;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class ExchangeAdapterFactoryTest {
  private static final ImmutableList<CurrencyPair> PAIRS =
      ImmutableList.of(CurrencyPair.fromSymbol("BTC/USD"));

  @Bind private Clock clock = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

  @Inject private ExchangeAdapter.Factory factory;

  @Before
  public void setUp() {
    Guice.createInjector(ExchangesModule.create(), BoundFieldModule.of(this)).injectMembers(this);
  }

  @Test
  public void create_supportedExchange_returnsAdapterWithThatName(
      @TestParameter({"coinbase", "binance", "kraken", "Kraken"}) String exchange) {
    // Act
    ExchangeAdapter adapter = factory.create(exchange, PAIRS, "worker-test");

    // Assert
    assertThat(adapter.name()).isEqualTo(exchange.toLowerCase());
    assertThat(adapter.currencyPairs()).isEqualTo(PAIRS);
  }

  @Test
  public void create_unknownExchange_throws() {
    assertThrows(ConfigurationException.class, () -> factory.create("mtgox", PAIRS, "worker-test"));
  }

  @Test
  public void create_noPairs_throws() {
    assertThrows(ConfigurationException.class,
        () -> factory.create("coinbase", ImmutableList.of(), "worker-test"));
  }
}
