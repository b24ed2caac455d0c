package com.verlumen.chrono.collector;

import com.google.auto.value.AutoValue;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.verlumen.chrono.execution.ConfigurationException;
import com.verlumen.chrono.instruments.CurrencyPair;
import java.time.Duration;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Construction-time settings of one collector worker. Never mutated while running.
 *
 * <p>{@link Builder#build()} fails with {@link ConfigurationException} before anything connects.
 */
@AutoValue
public abstract class CollectorConfig {
    public static final int MAX_BATCH_SIZE = 100;
    public static final ImmutableList<CurrencyPair> DEFAULT_PAIRS =
        ImmutableList.of(CurrencyPair.of("BTC", "USD"), CurrencyPair.of("ETH", "USD"));

    private static final Pattern WORKER_ID = Pattern.compile("^[a-z0-9_-]{1,100}$");
    private static final String WORKER_PREFIX = "worker-";

    public static Builder builder() {
        return new AutoValue_CollectorConfig.Builder()
            .setWorkerId("")
            .setExchanges(ImmutableList.of())
            .setCurrencyPairs(DEFAULT_PAIRS)
            .setIngestMode(IngestMode.HTTP)
            .setApiBase("")
            .setApiKey("")
            .setBatchSize(MAX_BATCH_SIZE)
            .setBatchInterval(Duration.ofSeconds(5))
            .setBufferCeiling(10_000)
            .setReconnectBackoff(ReconnectBackoff.create(10))
            .setDeliveryBackoff(ReconnectBackoff.create(3));
    }

    public abstract String workerId();

    /** Exchanges to connect to; derived from the worker id when not set. */
    public abstract ImmutableList<String> exchanges();

    public abstract ImmutableList<CurrencyPair> currencyPairs();

    public abstract IngestMode ingestMode();

    /** Base URL of the ingestion API, e.g. "https://api.example.com". */
    public abstract String apiBase();

    public abstract String apiKey();

    /** Buffered feeds that trigger an immediate flush. */
    public abstract int batchSize();

    /** Longest a buffered feed waits before a flush is triggered. */
    public abstract Duration batchInterval();

    /** Hard limit on buffered feeds; the oldest unsent feeds are evicted beyond it. */
    public abstract int bufferCeiling();

    public abstract ReconnectBackoff reconnectBackoff();

    /** Retry schedule for a batch whose delivery failed at the transport level. */
    public abstract ReconnectBackoff deliveryBackoff();

    public String ingestUrl() {
        String base = apiBase().endsWith("/") ? apiBase().substring(0, apiBase().length() - 1) : apiBase();
        return base + "/internal/ingest";
    }

    /**
     * Extracts the exchange from a worker id of the form {@code worker-{exchange}-{region}}.
     *
     * @throws ConfigurationException if the id does not follow that form
     */
    public static String exchangeFromWorkerId(String workerId) {
        List<String> parts = Splitter.on('-').splitToList(workerId);
        if (parts.size() < 3 || !workerId.startsWith(WORKER_PREFIX) || parts.get(1).isEmpty()) {
            throw new ConfigurationException(String.format(
                "Cannot derive exchange from worker id '%s'; expected worker-{exchange}-{region}",
                workerId));
        }
        return parts.get(1);
    }

    @AutoValue.Builder
    public abstract static class Builder {
        public abstract Builder setWorkerId(String workerId);

        public abstract Builder setExchanges(List<String> exchanges);

        public abstract Builder setCurrencyPairs(List<CurrencyPair> currencyPairs);

        public abstract Builder setIngestMode(IngestMode ingestMode);

        public abstract Builder setApiBase(String apiBase);

        public abstract Builder setApiKey(String apiKey);

        public abstract Builder setBatchSize(int batchSize);

        public abstract Builder setBatchInterval(Duration batchInterval);

        public abstract Builder setBufferCeiling(int bufferCeiling);

        public abstract Builder setReconnectBackoff(ReconnectBackoff reconnectBackoff);

        public abstract Builder setDeliveryBackoff(ReconnectBackoff deliveryBackoff);

        abstract String workerId();

        abstract ImmutableList<String> exchanges();

        abstract CollectorConfig autoBuild();

        public CollectorConfig build() {
            if (!WORKER_ID.matcher(workerId()).matches()) {
                throw new ConfigurationException("Invalid worker id: '" + workerId() + "'");
            }
            if (exchanges().isEmpty()) {
                setExchanges(ImmutableList.of(exchangeFromWorkerId(workerId())));
            }
            CollectorConfig config = autoBuild();
            validate(config);
            return config;
        }

        private static void validate(CollectorConfig config) {
            if (config.currencyPairs().isEmpty()) {
                throw new ConfigurationException("At least one currency pair is required");
            }
            if (config.batchSize() < 1 || config.batchSize() > MAX_BATCH_SIZE) {
                throw new ConfigurationException(String.format(
                    "Batch size must be between 1 and %d: %d", MAX_BATCH_SIZE, config.batchSize()));
            }
            if (config.batchInterval().isNegative() || config.batchInterval().isZero()) {
                throw new ConfigurationException("Batch interval must be positive: " + config.batchInterval());
            }
            if (config.bufferCeiling() <= config.batchSize()) {
                throw new ConfigurationException(String.format(
                    "Buffer ceiling %d must exceed batch size %d",
                    config.bufferCeiling(), config.batchSize()));
            }
            if (config.ingestMode() == IngestMode.HTTP) {
                if (config.apiBase().isEmpty()) {
                    throw new ConfigurationException("An API base URL is required for HTTP ingestion");
                }
                if (config.apiKey().isEmpty()) {
                    throw new ConfigurationException("An API key is required for HTTP ingestion");
                }
            }
        }
    }
}
