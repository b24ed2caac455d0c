package com.verlumen.chrono.marketdata;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableSortedSet;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.Optional;

/**
 * The fused price for a symbol derived from the latest reading of each contributing source.
 *
 * <p>{@link #price()} is always the median. A record is superseded, never mutated, by the next
 * aggregation cycle.
 */
@AutoValue
public abstract class ConsensusRecord {
    public static Builder builder() {
        return new AutoValue_ConsensusRecord.Builder();
    }

    public abstract String symbol();

    public abstract BigDecimal median();

    public abstract BigDecimal mean();

    /** Population standard deviation; absent for a single source. */
    public abstract Optional<BigDecimal> stdDev();

    /** Newest timestamp among the contributing feeds. */
    public abstract Instant timestamp();

    public abstract ImmutableSortedSet<String> sources();

    public final BigDecimal price() {
        return median();
    }

    public final int numSources() {
        return sources().size();
    }

    @AutoValue.Builder
    public abstract static class Builder {
        public abstract Builder setSymbol(String symbol);

        public abstract Builder setMedian(BigDecimal median);

        public abstract Builder setMean(BigDecimal mean);

        public abstract Builder setStdDev(BigDecimal stdDev);

        public abstract Builder setStdDev(Optional<BigDecimal> stdDev);

        public abstract Builder setTimestamp(Instant timestamp);

        public abstract Builder setSources(Collection<String> sources);

        public abstract ConsensusRecord build();
    }
}
