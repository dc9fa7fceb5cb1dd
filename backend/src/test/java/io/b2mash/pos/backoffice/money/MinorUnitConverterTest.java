package io.b2mash.pos.backoffice.money;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;

class MinorUnitConverterTest {

  @Test
  void toMinor_twoDecimalCurrency() {
    assertThat(MinorUnitConverter.toMinor("USD", new BigDecimal("10.13"))).isEqualTo(1013L);
  }

  @Test
  void toMinor_zeroDecimalCurrencyRoundsFirst() {
    assertThat(MinorUnitConverter.toMinor("JPY", "1234.56")).isEqualTo(1235L);
  }

  @Test
  void toMinor_threeDecimalCurrency() {
    assertThat(MinorUnitConverter.toMinor("KWD", "10.123")).isEqualTo(10123L);
  }

  @Test
  void toMinor_roundsHalfEven() {
    assertThat(MinorUnitConverter.toMinor("USD", "0.125")).isEqualTo(12L);
    assertThat(MinorUnitConverter.toMinor("USD", "0.135")).isEqualTo(14L);
  }

  @Test
  void toMinor_wholeAmountAndDouble() {
    assertThat(MinorUnitConverter.toMinor("USD", 7L)).isEqualTo(700L);
    assertThat(MinorUnitConverter.toMinor("USD", 19.99)).isEqualTo(1999L);
  }

  @Test
  void toMinor_overflowFails() {
    assertThatThrownBy(() -> MinorUnitConverter.toMinor("USD", new BigDecimal("1E20")))
        .isInstanceOf(ArithmeticException.class);
  }

  @Test
  void fromMinor_scaleMatchesCurrency() {
    assertThat(MinorUnitConverter.fromMinor("USD", 1013L)).isEqualTo(new BigDecimal("10.13"));
    assertThat(MinorUnitConverter.fromMinor("JPY", 1235L)).isEqualTo(new BigDecimal("1235"));
    assertThat(MinorUnitConverter.fromMinor("KWD", 10123L)).isEqualTo(new BigDecimal("10.123"));
    assertThat(MinorUnitConverter.fromMinor("USD", -5L)).isEqualTo(new BigDecimal("-0.05"));
  }

  @Test
  void roundTrip_preservesMinorUnits() {
    for (String currency : List.of("USD", "JPY", "KWD", "XYZ")) {
      for (long minor : new long[] {0L, 1L, -1L, 99L, 1013L, 123_456_789L, -987_654L}) {
        BigDecimal amount = MinorUnitConverter.fromMinor(currency, minor);
        assertThat(MinorUnitConverter.toMinor(currency, amount))
            .as("%s %d", currency, minor)
            .isEqualTo(minor);
      }
    }
  }

  // --- Percentages and proportions ---

  @Test
  void percentageOf_fractionalPercent() {
    // 8.5% of $100.00 = $8.50
    assertThat(
            MinorUnitConverter.percentageOf(
                "USD", new BigDecimal("100.00"), new BigDecimal("8.5")))
        .isEqualTo(850L);
  }

  @Test
  void percentageOf_roundsHalfEven() {
    // 10% of $0.25 = $0.025 -> $0.02
    assertThat(
            MinorUnitConverter.percentageOf("USD", new BigDecimal("0.25"), new BigDecimal("10")))
        .isEqualTo(2L);
  }

  @Test
  void proportionOf_halfOfTarget() {
    // 5.00 of 10.00 applied to 8.00 = 4.00
    assertThat(
            MinorUnitConverter.proportionOf(
                "USD", new BigDecimal("10.00"), new BigDecimal("5.00"), new BigDecimal("8.00")))
        .isEqualTo(400L);
  }

  @Test
  void proportionOf_zeroTotalYieldsZero() {
    assertThat(
            MinorUnitConverter.proportionOf(
                "USD", BigDecimal.ZERO, new BigDecimal("5.00"), new BigDecimal("8.00")))
        .isZero();
  }
}
