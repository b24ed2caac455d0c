package com.verlumen.chrono.collector;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.Module;
import com.verlumen.chrono.cache.CacheModule;
import com.verlumen.chrono.consensus.ConsensusAggregator;
import com.verlumen.chrono.consensus.ConsensusConfig;
import com.verlumen.chrono.consensus.ConsensusModule;
import com.verlumen.chrono.execution.ConfigurationException;
import com.verlumen.chrono.execution.ExecutionModule;
import com.verlumen.chrono.execution.RunMode;
import com.verlumen.chrono.gateway.GatewayConfig;
import com.verlumen.chrono.gateway.GatewayModule;
import com.verlumen.chrono.instruments.CurrencyPair;
import com.verlumen.chrono.kafka.KafkaDefaults;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;

final class App {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final String API_KEY_ENV_VAR = "CHRONO_API_KEY";
  private static final int SCHEDULER_THREADS = 4;
  private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  private final PriceCollector collector;
  private final Optional<ConsensusAggregator> aggregator;
  private final ScheduledExecutorService scheduler;
  private final RunMode runMode;
  private final CountDownLatch stopped = new CountDownLatch(1);

  @Inject
  App(
      PriceCollector collector,
      Optional<ConsensusAggregator> aggregator,
      ScheduledExecutorService scheduler,
      RunMode runMode) {
    this.collector = collector;
    this.aggregator = aggregator;
    this.scheduler = scheduler;
    this.runMode = runMode;
  }

  void run(Duration statusInterval) throws InterruptedException {
    logger.atInfo().log("Starting application in %s mode", runMode);
    aggregator.ifPresent(ConsensusAggregator::start);
    collector.start();

    scheduler.scheduleAtFixedRate(
        this::logStatus, statusInterval.toMillis(), statusInterval.toMillis(), TimeUnit.MILLISECONDS);
    Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "chrono-shutdown"));
    stopped.await();
  }

  private void logStatus() {
    try {
      logger.atInfo().log("Collector status: %s", collector.status().toJson());
    } catch (RuntimeException e) {
      logger.atWarning().withCause(e).log("Failed to collect status");
    }
  }

  private void shutdown() {
    logger.atInfo().log("Shutdown requested");
    try {
      collector.shutdown();
      aggregator.ifPresent(ConsensusAggregator::shutdown);
    } catch (RuntimeException e) {
      logger.atSevere().withCause(e).log("Error during shutdown");
    } finally {
      scheduler.shutdownNow();
      stopped.countDown();
    }
  }

  public static void main(String[] args) throws Exception {
    ArgumentParser parser = createParser();
    Namespace namespace;
    try {
      namespace = parser.parseArgs(args);
    } catch (ArgumentParserException e) {
      parser.handleError(e);
      System.exit(2);
      return;
    }

    try {
      CollectorConfig config = collectorConfig(namespace);
      RunMode runMode = RunMode.fromString(namespace.getString("runMode"));
      ImmutableList<Module> modules = modules(namespace, config, runMode);
      App app = Guice.createInjector(modules).getInstance(App.class);
      logger.atInfo().log("Guice initialization complete, running collector %s", config.workerId());
      app.run(Duration.ofSeconds(namespace.getInt("statusIntervalSeconds")));
    } catch (ConfigurationException e) {
      logger.atSevere().withCause(e).log("Invalid configuration");
      throw e;
    } catch (Exception e) {
      logger.atSevere().withCause(e).log("Fatal error during application startup");
      throw e;
    }
  }

  static CollectorConfig collectorConfig(Namespace namespace) {
    ImmutableList<CurrencyPair> pairs;
    try {
      pairs = LIST_SPLITTER.splitToStream(namespace.getString("symbols"))
          .map(CurrencyPair::fromSymbol)
          .collect(toImmutableList());
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Invalid symbol list: " + namespace.getString("symbols"), e);
    }
    List<String> exchanges = LIST_SPLITTER.splitToList(namespace.getString("exchanges"));

    int maxReconnectAttempts = namespace.getInt("maxReconnectAttempts");
    int deliveryRetries = namespace.getInt("deliveryRetries");
    if (maxReconnectAttempts < 0 || deliveryRetries < 0) {
      throw new ConfigurationException("Retry counts must not be negative");
    }
    return CollectorConfig.builder()
        .setWorkerId(namespace.getString("workerId"))
        .setExchanges(exchanges)
        .setCurrencyPairs(pairs)
        .setIngestMode(IngestMode.fromString(namespace.getString("ingestMode")))
        .setApiBase(namespace.getString("apiBase"))
        .setApiKey(namespace.getString("apiKey"))
        .setBatchSize(namespace.getInt("batchSize"))
        .setBatchInterval(Duration.ofMillis(namespace.getLong("batchIntervalMs")))
        .setBufferCeiling(namespace.getInt("bufferCeiling"))
        .setReconnectBackoff(ReconnectBackoff.create(maxReconnectAttempts))
        .setDeliveryBackoff(ReconnectBackoff.create(deliveryRetries))
        .build();
  }

  private static ImmutableList<Module> modules(
      Namespace namespace, CollectorConfig config, RunMode runMode) {
    ImmutableList.Builder<Module> modules = ImmutableList.<Module>builder()
        .add(ExecutionModule.create(runMode, SCHEDULER_THREADS))
        .add(CollectorModule.create(config));
    if (config.ingestMode() == IngestMode.LOCAL) {
      ConsensusConfig consensusConfig = new ConsensusConfig(
          Duration.ofMillis(namespace.getLong("aggregationCadenceMs")),
          Duration.ofMillis(namespace.getLong("aggregationWindowMs")),
          namespace.getInt("minSources"),
          namespace.getString("consensusTopic"));
      modules
          .add(GatewayModule.create(GatewayConfig.defaults()))
          .add(CacheModule.create(namespace.getInt("broadcastQueueCapacity")))
          .add(ConsensusModule.create(
              consensusConfig,
              runMode,
              namespace.getString("kafka.bootstrap.servers"),
              config.workerId()));
    }
    return modules.build();
  }

  static ArgumentParser createParser() {
    ArgumentParser parser = ArgumentParsers.newFor("ChronoCollector")
      .build()
      .defaultHelp(true)
      .description("Collects exchange prices and forwards them for consensus aggregation");

    // Worker configuration
    parser.addArgument("--workerId")
      .required(true)
      .help("Worker id, worker-{exchange}-{region}; the exchange is derived from it when --exchanges is empty");

    parser.addArgument("--exchanges")
      .setDefault("")
      .help("Comma-separated exchanges to collect from (coinbase, binance, kraken)");

    parser.addArgument("--symbols")
      .setDefault("BTC/USD,ETH/USD")
      .help("Comma-separated BASE/QUOTE symbols");

    // Ingestion configuration
    parser.addArgument("--ingestMode")
      .choices("http", "local")
      .setDefault("http")
      .help("Post batches to a remote API, or run gateway and aggregation in process");

    parser.addArgument("--apiBase")
      .setDefault("")
      .help("Base URL of the ingestion API");

    parser.addArgument("--apiKey")
      .setDefault(System.getenv().getOrDefault(API_KEY_ENV_VAR, ""))
      .help("Ingestion API key (default: value of " + API_KEY_ENV_VAR + " environment variable)");

    parser.addArgument("--batchSize")
      .type(Integer.class)
      .setDefault(CollectorConfig.MAX_BATCH_SIZE)
      .help("Feeds per batch, at most " + CollectorConfig.MAX_BATCH_SIZE);

    parser.addArgument("--batchIntervalMs")
      .type(Long.class)
      .setDefault(5_000L)
      .help("Longest a feed waits in the buffer");

    parser.addArgument("--bufferCeiling")
      .type(Integer.class)
      .setDefault(10_000)
      .help("Buffered feeds beyond which the oldest are evicted");

    parser.addArgument("--maxReconnectAttempts")
      .type(Integer.class)
      .setDefault(10)
      .help("Consecutive reconnect attempts before a connection gives up");

    parser.addArgument("--deliveryRetries")
      .type(Integer.class)
      .setDefault(3)
      .help("Retries of a batch whose delivery failed before it is dropped");

    // Consensus configuration (local mode)
    parser.addArgument("--minSources")
      .type(Integer.class)
      .setDefault(ConsensusConfig.DEFAULT_MINIMUM_SOURCES)
      .help("Fewest distinct sources that make a consensus");

    parser.addArgument("--aggregationCadenceMs")
      .type(Long.class)
      .setDefault(ConsensusConfig.DEFAULT_CADENCE.toMillis())
      .help("Time between aggregation cycles");

    parser.addArgument("--aggregationWindowMs")
      .type(Long.class)
      .setDefault(ConsensusConfig.DEFAULT_WINDOW.toMillis())
      .help("Trailing window each aggregation cycle considers");

    parser.addArgument("--broadcastQueueCapacity")
      .type(Integer.class)
      .setDefault(CacheModule.DEFAULT_QUEUE_CAPACITY)
      .help("Records a live subscriber may fall behind before it is disconnected");

    // Kafka configuration
    parser.addArgument("--kafka.bootstrap.servers")
      .setDefault(KafkaDefaults.BOOTSTRAP_SERVERS)
      .help("Kafka bootstrap servers");

    parser.addArgument("--consensusTopic")
      .setDefault(KafkaDefaults.CONSENSUS_TOPIC)
      .help("Kafka topic for publishing consensus history");

    // Run mode configuration
    parser.addArgument("--runMode")
      .choices("wet", "dry")
      .setDefault("wet")
      .help("Run mode: wet or dry");

    parser.addArgument("--statusIntervalSeconds")
      .type(Integer.class)
      .setDefault(60)
      .help("How often the collector status is logged");

    return parser;
  }
}
