package com.verlumen.chrono.instruments;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.collect.MoreCollectors.onlyElement;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.NoSuchElementException;
import java.util.stream.Stream;

/**
 * A tradable pair of currencies in canonical "BASE/QUOTE" form, e.g. "BTC/USD".
 *
 * <p>The base currency is the one being priced; the counter (quote) currency is the one the price
 * is expressed in.
 */
public record CurrencyPair(Currency base, Currency counter) {
  private static final String FORWARD_SLASH = "/";
  private static final String HYPHEN = "-";

  public CurrencyPair {
    checkArgument(!base.equals(counter), "Base and counter must differ: %s", base.symbol());
  }

  /**
   * Parses a symbol delimited by either "/" or "-" ("EUR/USD", "BTC-USD").
   *
   * @throws IllegalArgumentException if the symbol does not contain exactly one kind of delimiter
   *     separating two distinct currencies.
   */
  public static CurrencyPair fromSymbol(String symbol) {
    ImmutableList<String> symbolParts = splitSymbol(symbol);
    return new CurrencyPair(Currency.create(symbolParts.get(0)), Currency.create(symbolParts.get(1)));
  }

  public static CurrencyPair of(String base, String counter) {
    return new CurrencyPair(Currency.create(base), Currency.create(counter));
  }

  private static ImmutableList<String> splitSymbol(String symbol) {
    try {
      checkArgument(symbol != null, "Symbol must not be null");
      String delimiter =
          Stream.of(FORWARD_SLASH, HYPHEN).filter(symbol::contains).collect(onlyElement());

      ImmutableList<String> parts =
          Splitter.on(delimiter)
              .trimResults()
              .omitEmptyStrings()
              .splitToStream(symbol)
              .map(String::toUpperCase)
              .distinct()
              .collect(toImmutableList());

      checkArgument(parts.size() == 2, "Symbol must contain exactly two currencies: %s", symbol);
      return parts;
    } catch (NoSuchElementException | IllegalArgumentException e) {
      throw new IllegalArgumentException(
          String.format("Unable to parse currency pair, invalid symbol: \"%s\".", symbol), e);
    }
  }

  /** The canonical "BASE/QUOTE" form. */
  public String symbol() {
    return base.symbol() + FORWARD_SLASH + counter.symbol();
  }

  /** Joins base and counter with an arbitrary exchange-specific delimiter. */
  public String symbol(String delimiter) {
    return base.symbol() + delimiter + counter.symbol();
  }

  @Override
  public String toString() {
    return symbol();
  }
}
