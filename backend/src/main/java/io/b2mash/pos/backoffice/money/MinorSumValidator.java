package io.b2mash.pos.backoffice.money;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Checks that minor-unit components add up to an expected total. */
public final class MinorSumValidator {

  private static final Logger log = LoggerFactory.getLogger(MinorSumValidator.class);

  private MinorSumValidator() {}

  /** Requires an exact match. */
  public static void validate(long[] components, long expected, String context) {
    validate(components, expected, 0L, context);
  }

  /**
   * Throws if {@code |sum(components) - expected| > tolerance}.
   *
   * @param context short description used in the message, may be null
   * @throws MinorSumMismatchException on mismatch
   */
  public static void validate(long[] components, long expected, long tolerance, String context) {
    Objects.requireNonNull(components, "components must not be null");
    if (tolerance < 0) {
      throw new IllegalArgumentException("Tolerance must not be negative, got " + tolerance);
    }
    long actual = 0L;
    for (long component : components) {
      actual = Math.addExact(actual, component);
    }
    long diff = actual - expected;
    if (Math.abs(diff) > tolerance) {
      String message =
          "Minor unit sum mismatch%s: expected %d, got %d (diff: %s%d)"
              .formatted(
                  context == null || context.isBlank() ? "" : " " + context,
                  expected,
                  actual,
                  diff > 0 ? "+" : "",
                  diff);
      log.error(message);
      throw new MinorSumMismatchException(message, expected, actual);
    }
  }

  /**
   * Requires two amounts to be identical, reporting both as formatted money so the drift is
   * readable in logs, e.g. {@code "Penny drift detected! Expected $10.00, got $10.01 (diff:
   * +$0.01)"}.
   *
   * @throws MinorSumMismatchException if the amounts differ
   */
  public static void requireNoDrift(long expected, long actual, String currency, String message) {
    if (expected == actual) {
      return;
    }
    long diff = actual - expected;
    String detail =
        "Penny drift detected! Expected %s, got %s (diff: %s%s)"
            .formatted(
                MoneyFormatter.format(currency, expected),
                MoneyFormatter.format(currency, actual),
                diff > 0 ? "+" : "-",
                MoneyFormatter.format(currency, Math.abs(diff)));
    String full = message == null || message.isBlank() ? detail : message + ": " + detail;
    log.error(full);
    throw new MinorSumMismatchException(full, expected, actual);
  }
}
