package io.b2mash.pos.backoffice.money;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class MinorUnitAllocatorTest {

  // --- Worked examples ---

  @Test
  void allocate_equalWeights_remainderToFirst() {
    assertThat(MinorUnitAllocator.allocate(new long[] {100, 100, 100}, 100))
        .containsExactly(34, 33, 33);
  }

  @Test
  void allocate_largestResidualWins() {
    // 22.22 / 33.33 / 44.44 -> the .44 residual takes the spare cent
    assertThat(MinorUnitAllocator.allocate(new long[] {1000, 1500, 2000}, 100))
        .containsExactly(22, 33, 45);
  }

  @Test
  void allocate_tiesGoToLowerIndex() {
    assertThat(MinorUnitAllocator.allocate(new long[] {1, 1, 1}, 10)).containsExactly(4, 3, 3);
    assertThat(MinorUnitAllocator.allocate(new long[] {0, 5, 5}, 3)).containsExactly(0, 2, 1);
  }

  @Test
  void allocate_exactDivisionHasNoRemainder() {
    assertThat(MinorUnitAllocator.allocate(new long[] {1, 3}, 400)).containsExactly(100, 300);
  }

  // --- Degenerate inputs ---

  @Test
  void allocate_zeroWeightsYieldZeros() {
    assertThat(MinorUnitAllocator.allocate(new long[] {0, 0, 0}, 500)).containsExactly(0, 0, 0);
  }

  @Test
  void allocate_zeroTotalYieldsZeros() {
    assertThat(MinorUnitAllocator.allocate(new long[] {10, 20}, 0)).containsExactly(0, 0);
  }

  @Test
  void allocate_emptyWeights() {
    assertThat(MinorUnitAllocator.allocate(new long[0], 100)).isEmpty();
  }

  @Test
  void allocate_zeroWeightNeverReceivesRemainder() {
    assertThat(MinorUnitAllocator.allocate(new long[] {0, 1, 0, 1}, 3))
        .containsExactly(0, 2, 0, 1);
  }

  @Test
  void allocate_negativeWeightRejected() {
    assertThatThrownBy(() -> MinorUnitAllocator.allocate(new long[] {5, -1}, 10))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("index 1");
  }

  @Test
  void allocate_negativeTotalMirrorsPositive() {
    assertThat(MinorUnitAllocator.allocate(new long[] {1, 1, 1}, -10))
        .containsExactly(-4, -3, -3);
  }

  @Test
  void allocate_hugeValuesStayExact() {
    long half = Long.MAX_VALUE / 2;
    long[] result = MinorUnitAllocator.allocate(new long[] {half, half, 1}, Long.MAX_VALUE);
    assertThat(Arrays.stream(result).sum()).isEqualTo(Long.MAX_VALUE);

    long[] negative = MinorUnitAllocator.allocate(new long[] {1, 1}, Long.MIN_VALUE);
    assertThat(negative).containsExactly(Long.MIN_VALUE / 2, Long.MIN_VALUE / 2);
  }

  @Test
  void allocate_isDeterministic() {
    long[] weights = {1599, 2500, 570, 3, 0, 999};
    long[] first = MinorUnitAllocator.allocate(weights, 1234);
    for (int i = 0; i < 10; i++) {
      assertThat(MinorUnitAllocator.allocate(weights, 1234)).containsExactly(first);
    }
  }

  @Test
  void allocate_boxedVariantMatches() {
    assertThat(MinorUnitAllocator.allocate(List.of(1000L, 1500L, 2000L), 100L))
        .containsExactly(22L, 33L, 45L);
  }

  @Test
  void allocate_randomizedInputsAlwaysSumExactly() {
    var random = new Random(20240917L);
    for (int run = 0; run < 2000; run++) {
      int n = 1 + random.nextInt(20);
      long[] weights = new long[n];
      for (int i = 0; i < n; i++) {
        weights[i] = random.nextInt(4) == 0 ? 0 : random.nextInt(1_000_000);
      }
      long total = random.nextInt(10_000_000) - 1_000_000L;

      long[] result = MinorUnitAllocator.allocate(weights, total);

      long weightSum = Arrays.stream(weights).sum();
      long expectedSum = weightSum == 0 ? 0 : total;
      assertThat(Arrays.stream(result).sum()).as("run %d", run).isEqualTo(expectedSum);
      for (int i = 0; i < n; i++) {
        if (weights[i] == 0) {
          assertThat(result[i]).as("run %d index %d", run, i).isZero();
        }
        if (weightSum > 0) {
          // |result * W - weight * total| < W, i.e. each share is within one unit of exact
          BigInteger error =
              BigInteger.valueOf(result[i])
                  .multiply(BigInteger.valueOf(weightSum))
                  .subtract(BigInteger.valueOf(weights[i]).multiply(BigInteger.valueOf(total)))
                  .abs();
          assertThat(error).as("run %d index %d", run, i).isLessThan(BigInteger.valueOf(weightSum));
        }
      }
    }
  }

  // --- shareOf ---

  @Test
  void shareOf_isFirstEntryOfTwoWayAllocation() {
    // 500 * 1599 / 6268 = 127.55 -> 128
    assertThat(MinorUnitAllocator.shareOf(1599, 6268, 500)).isEqualTo(128L);
  }

  @Test
  void shareOf_wholeTakesEverything() {
    assertThat(MinorUnitAllocator.shareOf(6268, 6268, 500)).isEqualTo(500L);
    assertThat(MinorUnitAllocator.shareOf(0, 6268, 500)).isZero();
  }

  @Test
  void shareOf_partOutsideWholeRejected() {
    assertThatThrownBy(() -> MinorUnitAllocator.shareOf(7000, 6268, 500))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> MinorUnitAllocator.shareOf(-1, 6268, 500))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
