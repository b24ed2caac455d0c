package com.verlumen.chrono.collector;

import static com.google.common.base.Preconditions.checkState;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.chrono.exchanges.ExchangeAdapter;
import com.verlumen.chrono.instruments.CurrencyPair;

final class PriceCollectorImpl implements PriceCollector {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final CollectorConfig config;
  private final ExchangeAdapter.Factory adapterFactory;
  private final ConnectionManager.Factory connectionManagerFactory;
  private final BatchForwarder forwarder;

  private ImmutableList<ConnectionManager> connections = ImmutableList.of();

  @Inject
  PriceCollectorImpl(
      CollectorConfig config,
      ExchangeAdapter.Factory adapterFactory,
      ConnectionManager.Factory connectionManagerFactory,
      BatchForwarder forwarder) {
    this.config = config;
    this.adapterFactory = adapterFactory;
    this.connectionManagerFactory = connectionManagerFactory;
    this.forwarder = forwarder;
  }

  @Override
  public synchronized void start() {
    checkState(connections.isEmpty(), "Collector already started");
    logger.atInfo().log("Starting collector %s for %s on %s",
        config.workerId(), config.currencyPairs(), config.exchanges());

    // Adapters are all built before anything connects so a bad exchange name fails fast.
    ImmutableList<ExchangeAdapter> adapters = config.exchanges().stream()
        .map(exchange -> adapterFactory.create(exchange, config.currencyPairs(), config.workerId()))
        .collect(toImmutableList());

    connections = adapters.stream()
        .map(adapter -> connectionManagerFactory.create(adapter, forwarder::add))
        .collect(toImmutableList());
    connections.forEach(ConnectionManager::connect);
    logger.atInfo().log("Collector %s started %d connections", config.workerId(), connections.size());
  }

  @Override
  public synchronized void shutdown() {
    logger.atInfo().log("Beginning shutdown sequence...");

    logger.atInfo().log("Flushing batch forwarder...");
    forwarder.shutdown();

    logger.atInfo().log("Closing %d exchange connections...", connections.size());
    connections.forEach(ConnectionManager::disconnect);

    logger.atInfo().log("Shutdown sequence complete");
  }

  @Override
  public synchronized CollectorStatus status() {
    return new CollectorStatus(
        config.workerId(),
        config.currencyPairs().stream().map(CurrencyPair::symbol).collect(toImmutableList()),
        connections.stream().map(ConnectionManager::stats).collect(toImmutableList()),
        forwarder.stats());
  }
}
