package com.verlumen.chrono.consensus;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.inject.Inject;
import com.verlumen.chrono.marketdata.ConsensusRecord;
import com.verlumen.chrono.marketdata.PriceFeed;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reduces one symbol's feeds to a consensus record.
 *
 * <p>Only the latest feed of each source counts, so a fast exchange gets no extra weight. The
 * published price is the median. No outlier trimming is applied beyond that.
 */
public final class ConsensusCalculator {
    private static final MathContext PRECISION = MathContext.DECIMAL128;
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    @Inject
    ConsensusCalculator() {}

    /**
     * Returns empty when fewer than {@code minimumSources} distinct sources contributed, which is
     * distinct from a consensus of one.
     */
    public Optional<ConsensusRecord> compute(
        String symbol, Iterable<PriceFeed> feeds, int minimumSources) {
        Map<String, PriceFeed> latestBySource = new LinkedHashMap<>();
        for (PriceFeed feed : feeds) {
            if (!feed.symbol().equals(symbol)) {
                continue;
            }
            // Ties on timestamp go to the later element.
            latestBySource.merge(feed.source(), feed,
                (current, candidate) -> candidate.timestamp().isBefore(current.timestamp()) ? current : candidate);
        }
        if (latestBySource.isEmpty() || latestBySource.size() < minimumSources) {
            return Optional.empty();
        }

        ImmutableList<BigDecimal> prices = latestBySource.values().stream()
            .map(PriceFeed::price)
            .sorted()
            .collect(toImmutableList());
        BigDecimal mean = mean(prices);
        Instant timestamp = latestBySource.values().stream()
            .map(PriceFeed::timestamp)
            .max(Comparator.naturalOrder())
            .get();

        return Optional.of(ConsensusRecord.builder()
            .setSymbol(symbol)
            .setMedian(median(prices))
            .setMean(mean)
            .setStdDev(prices.size() < 2 ? Optional.empty() : Optional.of(populationStdDev(prices, mean)))
            .setTimestamp(timestamp)
            .setSources(ImmutableSortedSet.copyOf(latestBySource.keySet()))
            .build());
    }

    /** Exact: the midpoint of two finite decimals always terminates. */
    static BigDecimal median(ImmutableList<BigDecimal> sorted) {
        int middle = sorted.size() / 2;
        if (sorted.size() % 2 == 1) {
            return sorted.get(middle);
        }
        return sorted.get(middle - 1).add(sorted.get(middle)).divide(TWO);
    }

    static BigDecimal mean(ImmutableList<BigDecimal> values) {
        BigDecimal sum = values.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        return sum.divide(BigDecimal.valueOf(values.size()), PRECISION);
    }

    static BigDecimal populationStdDev(ImmutableList<BigDecimal> values, BigDecimal mean) {
        BigDecimal sumOfSquares = BigDecimal.ZERO;
        for (BigDecimal value : values) {
            BigDecimal deviation = value.subtract(mean);
            sumOfSquares = sumOfSquares.add(deviation.multiply(deviation));
        }
        BigDecimal variance = sumOfSquares.divide(BigDecimal.valueOf(values.size()), PRECISION);
        return variance.sqrt(PRECISION);
    }
}
