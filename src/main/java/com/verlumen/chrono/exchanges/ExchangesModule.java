package com.verlumen.chrono.exchanges;

import com.google.inject.AbstractModule;

public final class ExchangesModule extends AbstractModule {
  public static ExchangesModule create() {
    return new ExchangesModule();
  }

  private ExchangesModule() {}

  @Override
  protected void configure() {
    bind(ExchangeAdapter.Factory.class).to(ExchangeAdapterFactory.class);
  }
}
