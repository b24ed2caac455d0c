package com.verlumen.chrono.consensus;

import com.google.auto.value.AutoValue;
import com.google.inject.AbstractModule;
import com.google.inject.Singleton;
import com.google.inject.multibindings.OptionalBinder;
import com.verlumen.chrono.execution.RunMode;
import com.verlumen.chrono.kafka.KafkaModule;

@AutoValue
public abstract class ConsensusModule extends AbstractModule {
  public static ConsensusModule create(
      ConsensusConfig config, RunMode runMode, String kafkaBootstrapServers, String clientId) {
    return new AutoValue_ConsensusModule(config, runMode, kafkaBootstrapServers, clientId);
  }

  abstract ConsensusConfig config();

  abstract RunMode runMode();

  abstract String kafkaBootstrapServers();

  abstract String clientId();

  @Override
  protected void configure() {
    bind(ConsensusConfig.class).toInstance(config());
    OptionalBinder.newOptionalBinder(binder(), ConsensusAggregator.class)
        .setBinding()
        .to(ConsensusAggregatorImpl.class)
        .in(Singleton.class);

    if (runMode() == RunMode.WET) {
      install(KafkaModule.create(kafkaBootstrapServers(), clientId()));
      bind(ConsensusHistory.class).to(KafkaConsensusHistory.class).in(Singleton.class);
    } else {
      bind(ConsensusHistory.class).to(InMemoryConsensusHistory.class);
    }
  }
}
