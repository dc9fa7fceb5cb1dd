package io.b2mash.pos.backoffice.money;

/**
 * A set of minor-unit components does not add up to the total it was derived from. This is a
 * programming error in an allocation path, never a user error, and must not be caught and
 * retried.
 */
public class MinorSumMismatchException extends IllegalStateException {

  private final long expected;
  private final long actual;

  public MinorSumMismatchException(String message, long expected, long actual) {
    super(message);
    this.expected = expected;
    this.actual = actual;
  }

  public long getExpected() {
    return expected;
  }

  public long getActual() {
    return actual;
  }

  public long getDifference() {
    return actual - expected;
  }
}
