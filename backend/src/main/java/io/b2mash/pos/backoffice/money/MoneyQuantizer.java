package io.b2mash.pos.backoffice.money;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Rounds decimal amounts onto a currency's minor-unit grid.
 *
 * <p>Rounding is always {@link RoundingMode#HALF_EVEN}. Half-up rounding drifts upwards when it is
 * applied to many tax lines; half-even does not. Binary floating point never takes part: doubles
 * are converted through their decimal string form before rounding.
 */
public final class MoneyQuantizer {

  private MoneyQuantizer() {}

  /**
   * Rounds {@code amount} to the number of decimal places of {@code currency}.
   *
   * @param currency ISO 4217 code
   * @param amount any finite amount
   * @return the amount with scale equal to {@link CurrencyTable#exponent(String)}
   */
  public static BigDecimal quantize(String currency, BigDecimal amount) {
    Objects.requireNonNull(amount, "amount must not be null");
    return amount.setScale(CurrencyTable.exponent(currency), RoundingMode.HALF_EVEN);
  }

  /**
   * Parses {@code amount} as an exact decimal and rounds it.
   *
   * @throws IllegalArgumentException if the string is not a decimal number
   */
  public static BigDecimal quantize(String currency, String amount) {
    return quantize(currency, parse(amount));
  }

  public static BigDecimal quantize(String currency, long amount) {
    return quantize(currency, BigDecimal.valueOf(amount));
  }

  /**
   * Rounds a double after converting it through its shortest decimal representation, so that
   * {@code 0.1} is treated as {@code 0.1} and not as its binary expansion.
   *
   * @throws IllegalArgumentException if {@code amount} is NaN or infinite
   */
  public static BigDecimal quantize(String currency, double amount) {
    if (Double.isNaN(amount) || Double.isInfinite(amount)) {
      throw new IllegalArgumentException("Amount must be finite, got " + amount);
    }
    return quantize(currency, BigDecimal.valueOf(amount));
  }

  static BigDecimal parse(String amount) {
    Objects.requireNonNull(amount, "amount must not be null");
    try {
      return new BigDecimal(amount.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Not a decimal amount: '" + amount + "'", e);
    }
  }
}
