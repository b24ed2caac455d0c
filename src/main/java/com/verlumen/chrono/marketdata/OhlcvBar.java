package com.verlumen.chrono.marketdata;

import java.math.BigDecimal;
import java.time.Instant;

/** Open/high/low/close/volume for one symbol over one interval bucket starting at {@code start}. */
public record OhlcvBar(
        String symbol,
        Instant start,
        BigDecimal open,
        BigDecimal high,
        BigDecimal low,
        BigDecimal close,
        BigDecimal volume,
        int count) {}
