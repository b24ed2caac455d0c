package com.verlumen.chrono.consensus;

import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.chrono.marketdata.ConsensusRecord;
import com.verlumen.chrono.marketdata.MarketDataJson;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.function.Supplier;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.ProducerRecord;

/** Publishes each record as JSON to the history topic, keyed by symbol. */
final class KafkaConsensusHistory implements ConsensusHistory {
    private static final FluentLogger logger = FluentLogger.forEnclosingClass();
    private final Supplier<KafkaProducer<String, byte[]>> kafkaProducer;
    private final String topic;

    @Inject
    KafkaConsensusHistory(Supplier<KafkaProducer<String, byte[]>> kafkaProducer, ConsensusConfig config) {
        this.kafkaProducer = kafkaProducer;
        this.topic = config.historyTopic();
        logger.atInfo().log("Consensus history publishes to topic %s", topic);
    }

    @Override
    public void append(ConsensusRecord consensus) {
        byte[] payload = MarketDataJson.toJson(consensus).toString().getBytes(StandardCharsets.UTF_8);
        ProducerRecord<String, byte[]> record = new ProducerRecord<>(topic, consensus.symbol(), payload);

        kafkaProducer.get().send(record, (metadata, exception) -> {
            if (exception != null) {
                logger.atSevere().withCause(exception)
                    .log("Failed to publish consensus for %s to topic %s", consensus.symbol(), topic);
            } else {
                logger.atFine().log("Published consensus: topic=%s, partition=%d, offset=%d",
                    metadata.topic(), metadata.partition(), metadata.offset());
            }
        });
    }

    @Override
    public void close() {
        logger.atInfo().log("Initiating Kafka producer shutdown");
        KafkaProducer<String, byte[]> producer = kafkaProducer.get();
        try {
            producer.flush();
            producer.close(Duration.ofSeconds(5));
            logger.atInfo().log("Kafka producer closed successfully");
        } catch (RuntimeException e) {
            logger.atSevere().withCause(e).log("Error during Kafka producer shutdown");
            throw e;
        }
    }
}
