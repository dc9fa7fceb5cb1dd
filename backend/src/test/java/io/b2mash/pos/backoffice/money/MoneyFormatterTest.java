package io.b2mash.pos.backoffice.money;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class MoneyFormatterTest {

  @Test
  void format_usesCurrencySymbol() {
    assertThat(MoneyFormatter.format("USD", 1013)).isEqualTo("$10.13");
    assertThat(MoneyFormatter.format("EUR", 1050)).isEqualTo("€10.50");
    assertThat(MoneyFormatter.format("gbp", 5)).isEqualTo("£0.05");
  }

  @Test
  void format_zeroDecimalCurrencyGroupsThousands() {
    assertThat(MoneyFormatter.format("JPY", 1235)).isEqualTo("¥1,235");
  }

  @Test
  void format_largeAmountGroupsThousands() {
    assertThat(MoneyFormatter.format("USD", 123_456_789)).isEqualTo("$1,234,567.89");
  }

  @Test
  void format_negativeAmount() {
    assertThat(MoneyFormatter.format("USD", -150)).isEqualTo("-$1.50");
  }

  @Test
  void format_currencyWithoutSymbolUsesCode() {
    assertThat(MoneyFormatter.format("KWD", 10123)).isEqualTo("KWD 10.123");
  }
}
