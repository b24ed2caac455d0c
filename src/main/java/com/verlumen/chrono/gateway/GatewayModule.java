package com.verlumen.chrono.gateway;

import com.google.auto.value.AutoValue;
import com.google.common.base.Ticker;
import com.google.inject.AbstractModule;

@AutoValue
public abstract class GatewayModule extends AbstractModule {
  public static GatewayModule create(GatewayConfig config) {
    return new AutoValue_GatewayModule(config);
  }

  abstract GatewayConfig config();

  @Override
  protected void configure() {
    bind(GatewayConfig.class).toInstance(config());
    bind(IngestionGateway.class).to(IngestionGatewayImpl.class);
    bind(PriceFeedStore.class).to(InMemoryPriceFeedStore.class);
    bind(Ticker.class).toInstance(Ticker.systemTicker());
  }
}
