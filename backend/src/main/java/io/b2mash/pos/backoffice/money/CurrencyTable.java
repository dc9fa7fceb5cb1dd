package io.b2mash.pos.backoffice.money;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * ISO 4217 minor-unit exponents, i.e. the number of decimal places in one minor unit of a
 * currency. Codes that are not listed fall back to {@link #DEFAULT_EXPONENT}; this is reference
 * data, so an unknown code is not an error.
 */
public final class CurrencyTable {

  public static final int DEFAULT_EXPONENT = 2;

  private static final Map<String, Integer> EXPONENTS =
      Map.ofEntries(
          // two decimals
          Map.entry("USD", 2),
          Map.entry("EUR", 2),
          Map.entry("GBP", 2),
          Map.entry("CAD", 2),
          Map.entry("AUD", 2),
          Map.entry("CHF", 2),
          Map.entry("CNY", 2),
          Map.entry("INR", 2),
          // no subunit
          Map.entry("JPY", 0),
          Map.entry("KRW", 0),
          Map.entry("VND", 0),
          Map.entry("CLP", 0),
          // three decimals
          Map.entry("KWD", 3),
          Map.entry("BHD", 3),
          Map.entry("OMR", 3),
          Map.entry("JOD", 3),
          Map.entry("TND", 3));

  private CurrencyTable() {}

  /**
   * Returns the minor-unit exponent for the given currency code. Lookup is case-insensitive.
   *
   * @param currency ISO 4217 code, e.g. "USD"
   * @return 0, 2 or 3; {@value #DEFAULT_EXPONENT} for unrecognised codes
   */
  public static int exponent(String currency) {
    return EXPONENTS.getOrDefault(normalize(currency), DEFAULT_EXPONENT);
  }

  /** Returns the value of one minor unit, e.g. 0.01 for USD, 1 for JPY, 0.001 for KWD. */
  public static BigDecimal quantum(String currency) {
    return BigDecimal.ONE.movePointLeft(exponent(currency));
  }

  public static boolean isKnown(String currency) {
    return EXPONENTS.containsKey(normalize(currency));
  }

  static String normalize(String currency) {
    Objects.requireNonNull(currency, "currency must not be null");
    return currency.trim().toUpperCase(Locale.ROOT);
  }
}
