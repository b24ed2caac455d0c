package com.verlumen.chrono.collector;

import com.google.auto.value.AutoValue;
import com.google.inject.AbstractModule;
import com.google.inject.Singleton;
import com.google.inject.assistedinject.FactoryModuleBuilder;
import com.google.inject.multibindings.OptionalBinder;
import com.verlumen.chrono.consensus.ConsensusAggregator;
import com.verlumen.chrono.exchanges.ExchangesModule;
import com.verlumen.chrono.http.HttpModule;

@AutoValue
abstract class CollectorModule extends AbstractModule {
  static CollectorModule create(CollectorConfig config) {
    return new AutoValue_CollectorModule(config);
  }

  abstract CollectorConfig config();

  @Override
  protected void configure() {
    bind(CollectorConfig.class).toInstance(config());
    bind(BatchForwarder.class).to(BatchForwarderImpl.class).in(Singleton.class);
    bind(PriceCollector.class).to(PriceCollectorImpl.class).in(Singleton.class);
    if (config().ingestMode() == IngestMode.LOCAL) {
      bind(IngestionClient.class).to(LocalIngestionClient.class);
    } else {
      bind(IngestionClient.class).to(HttpIngestionClient.class);
    }

    // Bound by ConsensusModule when the pipeline runs in process.
    OptionalBinder.newOptionalBinder(binder(), ConsensusAggregator.class);

    install(new FactoryModuleBuilder()
        .implement(ConnectionManager.class, WebSocketConnectionManager.class)
        .build(ConnectionManager.Factory.class));
    install(ExchangesModule.create());
    install(HttpModule.create());
  }
}
