package com.verlumen.chrono.exchanges;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Inject;
import com.verlumen.chrono.execution.ConfigurationException;
import com.verlumen.chrono.instruments.CurrencyPair;
import java.time.Clock;

final class ExchangeAdapterFactory implements ExchangeAdapter.Factory {
  private interface AdapterConstructor {
    ExchangeAdapter create(ImmutableList<CurrencyPair> pairs, String workerId);
  }

  private final ImmutableMap<String, AdapterConstructor> adapterMap;

  @Inject
  ExchangeAdapterFactory(Clock clock) {
    this.adapterMap = ImmutableMap.<String, AdapterConstructor>builder()
      .put(CoinbaseAdapter.NAME, CoinbaseAdapter::new)
      .put(BinanceAdapter.NAME, BinanceAdapter::new)
      .put(KrakenAdapter.NAME, (pairs, workerId) -> new KrakenAdapter(clock, pairs, workerId))
      .buildOrThrow();
  }

  @Override
  public ExchangeAdapter create(String exchange, ImmutableList<CurrencyPair> pairs, String workerId) {
    AdapterConstructor constructor = adapterMap.get(Ascii.toLowerCase(exchange));
    if (constructor == null) {
      throw new ConfigurationException(
          String.format("Unsupported exchange '%s', expected one of %s", exchange, adapterMap.keySet()));
    }
    if (pairs.isEmpty()) {
      throw new ConfigurationException("No currency pairs configured for " + exchange);
    }
    return constructor.create(pairs, workerId);
  }
}
