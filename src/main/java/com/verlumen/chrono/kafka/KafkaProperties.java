package com.verlumen.chrono.kafka;

import java.util.Properties;
import java.util.function.Supplier;

/** Producer settings for the consensus history topic. */
public record KafkaProperties(
    int batchSize,
    String bootstrapServers,
    String clientId,
    int bufferMemory,
    String keySerializer,
    String valueSerializer,
    String securityProtocol,
    String saslMechanism,
    String saslJaasConfig,
    String acks,
    int lingerMs,
    int retries)
    implements Supplier<Properties> {

  public static KafkaProperties create(String bootstrapServers, String clientId) {
    return new KafkaProperties(
        KafkaDefaults.BATCH_SIZE,
        bootstrapServers,
        clientId,
        KafkaDefaults.BUFFER_MEMORY,
        KafkaDefaults.KEY_SERIALIZER,
        KafkaDefaults.VALUE_SERIALIZER,
        KafkaDefaults.SECURITY_PROTOCOL,
        "",
        "",
        KafkaDefaults.ACKS,
        KafkaDefaults.LINGER_MS,
        KafkaDefaults.RETRIES);
  }

  @Override
  public Properties get() {
    Properties kafkaProperties = new Properties();
    kafkaProperties.setProperty("acks", acks);
    kafkaProperties.setProperty("batch.size", Integer.toString(batchSize));
    kafkaProperties.setProperty("bootstrap.servers", bootstrapServers);
    kafkaProperties.setProperty("client.id", clientId);
    kafkaProperties.setProperty("retries", Integer.toString(retries));
    kafkaProperties.setProperty("linger.ms", Integer.toString(lingerMs));
    kafkaProperties.setProperty("buffer.memory", Integer.toString(bufferMemory));
    kafkaProperties.setProperty("key.serializer", keySerializer);
    kafkaProperties.setProperty("value.serializer", valueSerializer);
    kafkaProperties.setProperty("security.protocol", securityProtocol);
    // SASL settings only apply to SASL_* protocols; empty values are rejected by the client.
    if (!saslMechanism.isEmpty()) {
      kafkaProperties.setProperty("sasl.mechanism", saslMechanism);
    }
    if (!saslJaasConfig.isEmpty()) {
      kafkaProperties.setProperty("sasl.jaas.config", saslJaasConfig);
    }
    return kafkaProperties;
  }
}
