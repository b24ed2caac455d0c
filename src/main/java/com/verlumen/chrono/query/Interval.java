package com.verlumen.chrono.query;

import com.google.common.collect.ImmutableMap;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/** OHLCV bucket widths accepted by range queries. Buckets are aligned to the epoch. */
public enum Interval {
    ONE_MINUTE("1m", Duration.ofMinutes(1)),
    FIVE_MINUTES("5m", Duration.ofMinutes(5)),
    FIFTEEN_MINUTES("15m", Duration.ofMinutes(15)),
    ONE_HOUR("1h", Duration.ofHours(1)),
    FOUR_HOURS("4h", Duration.ofHours(4)),
    ONE_DAY("1d", Duration.ofDays(1));

    private static final ImmutableMap<String, Interval> BY_LABEL = ImmutableMap.copyOf(
        Arrays.stream(values()).collect(Collectors.toMap(Interval::label, Function.identity())));

    private final String label;
    private final Duration duration;

    Interval(String label, Duration duration) {
        this.label = label;
        this.duration = duration;
    }

    public String label() {
        return label;
    }

    public Duration duration() {
        return duration;
    }

    /** Start of the bucket containing {@code instant}. */
    public Instant bucketStart(Instant instant) {
        long width = duration.toMillis();
        return Instant.ofEpochMilli(Math.floorDiv(instant.toEpochMilli(), width) * width);
    }

    public static Optional<Interval> fromLabel(String label) {
        return Optional.ofNullable(BY_LABEL.get(label));
    }
}
