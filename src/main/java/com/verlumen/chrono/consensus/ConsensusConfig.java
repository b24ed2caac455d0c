package com.verlumen.chrono.consensus;

import com.verlumen.chrono.execution.ConfigurationException;
import java.time.Duration;

/**
 * @param cadence time between aggregation cycles
 * @param window trailing window of feeds each cycle considers
 * @param minimumSources fewest distinct sources that make a consensus
 * @param historyTopic Kafka topic receiving published records in WET runs
 */
public record ConsensusConfig(
    Duration cadence, Duration window, int minimumSources, String historyTopic) {
  public static final Duration DEFAULT_CADENCE = Duration.ofSeconds(5);
  public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(10);
  public static final int DEFAULT_MINIMUM_SOURCES = 1;

  public ConsensusConfig {
    if (cadence.isNegative() || cadence.isZero()) {
      throw new ConfigurationException("Aggregation cadence must be positive: " + cadence);
    }
    if (window.isNegative() || window.isZero()) {
      throw new ConfigurationException("Aggregation window must be positive: " + window);
    }
    if (minimumSources < 1) {
      throw new ConfigurationException("Minimum sources must be at least 1: " + minimumSources);
    }
  }

  public static ConsensusConfig create(int minimumSources, String historyTopic) {
    return new ConsensusConfig(DEFAULT_CADENCE, DEFAULT_WINDOW, minimumSources, historyTopic);
  }
}
