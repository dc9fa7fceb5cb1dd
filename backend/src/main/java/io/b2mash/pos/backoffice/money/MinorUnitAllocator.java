package io.b2mash.pos.backoffice.money;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Exact-sum proportional distribution of an integer total over integer weights, using the
 * largest-remainder (Hare-Niemeyer) method.
 *
 * <p>Guarantees, for every valid input:
 *
 * <ul>
 *   <li>the result has one entry per weight and sums to exactly {@code total}
 *   <li>a zero weight receives zero
 *   <li>all-zero weights or a zero total yield all zeros
 *   <li>identical inputs yield identical outputs
 * </ul>
 *
 * <p>Shares are computed as exact rationals with {@link BigInteger}: {@code weight * total} is
 * divided by the weight sum, the quotient is the floor and the division remainder is the
 * residual numerator. All residuals share a denominator, so they are ranked by numerator. Ties go
 * to the lower index, which keeps results reproducible against previously recorded amounts.
 */
public final class MinorUnitAllocator {

  private MinorUnitAllocator() {}

  /**
   * Splits {@code total} proportionally to {@code weights}.
   *
   * @param weights non-negative weights, typically line subtotals in minor units
   * @param total amount to distribute in minor units; a negative total is distributed as the
   *     negation of the allocation of its absolute value
   * @return allocations in input order
   * @throws IllegalArgumentException if any weight is negative
   */
  public static long[] allocate(long[] weights, long total) {
    Objects.requireNonNull(weights, "weights must not be null");
    int n = weights.length;
    long[] result = new long[n];

    BigInteger weightSum = BigInteger.ZERO;
    for (int i = 0; i < n; i++) {
      if (weights[i] < 0) {
        throw new IllegalArgumentException(
            "Weight at index " + i + " is negative: " + weights[i]);
      }
      weightSum = weightSum.add(BigInteger.valueOf(weights[i]));
    }

    if (n == 0 || total == 0 || weightSum.signum() == 0) {
      return result;
    }

    BigInteger magnitude = BigInteger.valueOf(total).abs();
    BigInteger[] floors = new BigInteger[n];
    BigInteger[] residuals = new BigInteger[n];
    BigInteger assigned = BigInteger.ZERO;

    for (int i = 0; i < n; i++) {
      BigInteger[] qr =
          BigInteger.valueOf(weights[i]).multiply(magnitude).divideAndRemainder(weightSum);
      floors[i] = qr[0];
      residuals[i] = qr[1];
      assigned = assigned.add(qr[0]);
    }

    // 0 <= remainder < n, since each floor loses strictly less than one unit
    int remainder = magnitude.subtract(assigned).intValueExact();
    if (remainder > 0) {
      int[] winners =
          IntStream.range(0, n)
              .boxed()
              .sorted(
                  Comparator.comparing((Integer i) -> residuals[i])
                      .reversed()
                      .thenComparing(Comparator.naturalOrder()))
              .limit(remainder)
              .mapToInt(Integer::intValue)
              .toArray();
      for (int index : winners) {
        floors[index] = floors[index].add(BigInteger.ONE);
      }
    }

    // sign is applied before narrowing so that Long.MIN_VALUE totals still fit
    for (int i = 0; i < n; i++) {
      result[i] = (total < 0 ? floors[i].negate() : floors[i]).longValueExact();
    }
    return result;
  }

  /** Boxed variant of {@link #allocate(long[], long)}. */
  public static List<Long> allocate(List<Long> weights, long total) {
    Objects.requireNonNull(weights, "weights must not be null");
    long[] raw = weights.stream().mapToLong(Long::longValue).toArray();
    return Arrays.stream(allocate(raw, total)).boxed().toList();
  }

  /**
   * Returns the share of {@code total} that belongs to {@code part} out of {@code whole}, using a
   * two-weight allocation of {@code [part, whole - part]}. Used for proration where only one side
   * of the split matters.
   *
   * @throws IllegalArgumentException if {@code part} is negative or exceeds {@code whole}
   */
  public static long shareOf(long part, long whole, long total) {
    if (part < 0 || part > whole) {
      throw new IllegalArgumentException(
          "Part must be between 0 and " + whole + ", got " + part);
    }
    return allocate(new long[] {part, whole - part}, total)[0];
  }
}
