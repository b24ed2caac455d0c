package com.verlumen.chrono.query;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.verlumen.chrono.marketdata.OhlcvBar;
import com.verlumen.chrono.marketdata.PriceFeed;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * Accumulates feeds of one symbol into one OHLCV bar.
 *
 * <p>Feeds must be added in timestamp order: the first sets the open, the last the close. Volume
 * is the sum of the volumes reported by the feeds that carry one.
 *
 * <p>Not thread-safe.
 */
final class OhlcvBuilder {
    private final String symbol;
    private final Instant start;

    private BigDecimal open;
    private BigDecimal high;
    private BigDecimal low;
    private BigDecimal close;
    private BigDecimal volume = BigDecimal.ZERO;
    private int count;

    OhlcvBuilder(String symbol, Instant start) {
        this.symbol = symbol;
        this.start = start;
    }

    void add(PriceFeed feed) {
        checkArgument(feed.symbol().equals(symbol), "Feed for %s added to %s bar", feed.symbol(), symbol);
        BigDecimal price = feed.price();
        if (open == null) {
            open = price;
            high = price;
            low = price;
        } else {
            high = high.max(price);
            low = low.min(price);
        }
        close = price;
        volume = feed.volume().map(volume::add).orElse(volume);
        count++;
    }

    boolean hasFeeds() {
        return count > 0;
    }

    OhlcvBar build() {
        checkState(hasFeeds(), "No feeds added to %s bar at %s", symbol, start);
        return new OhlcvBar(symbol, start, open, high, low, close, volume, count);
    }
}
