package io.b2mash.pos.backoffice.money;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Converts between decimal amounts and integer minor units (cents, fils, yen).
 *
 * <p>Every conversion to minor units quantizes first. Shifting an unquantized amount would leave
 * trailing precision that then has to be truncated, which is exactly the drift this class
 * prevents.
 */
public final class MinorUnitConverter {

  private static final BigDecimal ONE_HUNDRED = new BigDecimal("100");

  private MinorUnitConverter() {}

  /**
   * Quantizes {@code amount} and returns it as a count of minor units.
   *
   * @throws ArithmeticException if the result does not fit in a {@code long}
   */
  public static long toMinor(String currency, BigDecimal amount) {
    BigDecimal quantized = MoneyQuantizer.quantize(currency, amount);
    return quantized.movePointRight(CurrencyTable.exponent(currency)).longValueExact();
  }

  public static long toMinor(String currency, String amount) {
    return toMinor(currency, MoneyQuantizer.parse(amount));
  }

  public static long toMinor(String currency, long amount) {
    return toMinor(currency, BigDecimal.valueOf(amount));
  }

  public static long toMinor(String currency, double amount) {
    return toMinor(currency, MoneyQuantizer.quantize(currency, amount));
  }

  /**
   * Converts minor units back to a decimal amount. Exact: dividing an integer by a power of ten
   * never needs rounding.
   *
   * @return an amount whose scale equals the currency exponent, e.g. 1013 USD -> 10.13
   */
  public static BigDecimal fromMinor(String currency, long minor) {
    return BigDecimal.valueOf(minor, CurrencyTable.exponent(currency));
  }

  /**
   * Returns {@code percent}% of {@code amount} in minor units, e.g. 8.5% of 100.00 USD = 850.
   *
   * @param percent a percentage such as 8.5, not a fraction
   */
  public static long percentageOf(String currency, BigDecimal amount, BigDecimal percent) {
    BigDecimal result = amount.multiply(percent).divide(ONE_HUNDRED, MathContext.DECIMAL128);
    return toMinor(currency, result);
  }

  /**
   * Prorates {@code target} by {@code part / total} and returns minor units, e.g. 5.00 of 10.00
   * applied to 8.00 USD = 400. A zero {@code total} yields zero.
   */
  public static long proportionOf(
      String currency, BigDecimal total, BigDecimal part, BigDecimal target) {
    if (total.signum() == 0) {
      return 0L;
    }
    BigDecimal result = part.multiply(target).divide(total, MathContext.DECIMAL128);
    return toMinor(currency, result);
  }
}
