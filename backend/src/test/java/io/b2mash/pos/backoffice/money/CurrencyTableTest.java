package io.b2mash.pos.backoffice.money;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class CurrencyTableTest {

  @Test
  void exponent_twoDecimalCurrencies() {
    assertThat(CurrencyTable.exponent("USD")).isEqualTo(2);
    assertThat(CurrencyTable.exponent("EUR")).isEqualTo(2);
    assertThat(CurrencyTable.exponent("GBP")).isEqualTo(2);
  }

  @Test
  void exponent_zeroDecimalCurrencies() {
    assertThat(CurrencyTable.exponent("JPY")).isZero();
    assertThat(CurrencyTable.exponent("KRW")).isZero();
  }

  @Test
  void exponent_threeDecimalCurrencies() {
    assertThat(CurrencyTable.exponent("KWD")).isEqualTo(3);
    assertThat(CurrencyTable.exponent("BHD")).isEqualTo(3);
  }

  @Test
  void exponent_isCaseInsensitive() {
    assertThat(CurrencyTable.exponent("jpy")).isZero();
    assertThat(CurrencyTable.exponent(" kwd ")).isEqualTo(3);
  }

  @Test
  void exponent_unknownCurrencyDefaultsToTwo() {
    assertThat(CurrencyTable.exponent("XYZ")).isEqualTo(CurrencyTable.DEFAULT_EXPONENT);
    assertThat(CurrencyTable.isKnown("XYZ")).isFalse();
    assertThat(CurrencyTable.isKnown("usd")).isTrue();
  }

  @Test
  void exponent_nullCurrencyRejected() {
    assertThatThrownBy(() -> CurrencyTable.exponent(null))
        .isInstanceOf(NullPointerException.class);
  }

  @Test
  void quantum_matchesExponent() {
    assertThat(CurrencyTable.quantum("USD")).isEqualByComparingTo(new BigDecimal("0.01"));
    assertThat(CurrencyTable.quantum("JPY")).isEqualByComparingTo(BigDecimal.ONE);
    assertThat(CurrencyTable.quantum("KWD")).isEqualByComparingTo(new BigDecimal("0.001"));
  }
}
