package com.verlumen.chrono.kafka;

import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import java.util.function.Supplier;
import org.apache.kafka.clients.producer.KafkaProducer;

final class KafkaProducerSupplier implements Supplier<KafkaProducer<String, byte[]>> {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private final KafkaProperties properties;

  @Inject
  KafkaProducerSupplier(KafkaProperties properties) {
    this.properties = properties;
  }

  @Override
  public KafkaProducer<String, byte[]> get() {
    logger.atInfo().log("Creating Kafka producer for %s", properties.bootstrapServers());
    return new KafkaProducer<>(properties.get());
  }
}
