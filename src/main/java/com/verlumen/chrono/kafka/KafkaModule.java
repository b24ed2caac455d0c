package com.verlumen.chrono.kafka;

import com.google.auto.value.AutoValue;
import com.google.common.base.Suppliers;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import java.util.function.Supplier;
import org.apache.kafka.clients.producer.KafkaProducer;

@AutoValue
public abstract class KafkaModule extends AbstractModule {
  public static KafkaModule create(String bootstrapServers, String clientId) {
    return new AutoValue_KafkaModule(bootstrapServers, clientId);
  }

  abstract String bootstrapServers();

  abstract String clientId();

  @Override
  protected void configure() {
    bind(KafkaProperties.class).toInstance(KafkaProperties.create(bootstrapServers(), clientId()));
  }

  /** The producer is created on first use so DRY wiring never touches a broker. */
  @Provides
  @Singleton
  Supplier<KafkaProducer<String, byte[]>> provideKafkaProducerSupplier(
      KafkaProducerSupplier supplier) {
    return Suppliers.memoize(supplier::get);
  }
}
