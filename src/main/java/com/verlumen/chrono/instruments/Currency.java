package com.verlumen.chrono.instruments;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;

/**
 * A currency or asset ticker such as "BTC" or "USD".
 *
 * <p>Symbols are stored upper case and may only contain ASCII letters and digits.
 */
public record Currency(String symbol) {
  private static final CharMatcher ALLOWED = CharMatcher.inRange('A', 'Z').or(CharMatcher.inRange('0', '9'));

  public Currency {
    checkArgument(symbol != null && !symbol.isEmpty(), "Currency symbol must not be null or empty.");
    checkArgument(ALLOWED.matchesAllOf(symbol), "Invalid currency symbol: \"%s\".", symbol);
  }

  /**
   * Creates a {@link Currency}, upper-casing the given ticker.
   *
   * @throws IllegalArgumentException if the symbol is null, empty or contains anything other than
   *     letters and digits.
   */
  public static Currency create(String symbol) {
    checkArgument(symbol != null, "Currency symbol must not be null or empty.");
    return new Currency(Ascii.toUpperCase(symbol.trim()));
  }
}
