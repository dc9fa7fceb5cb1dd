package io.b2mash.pos.backoffice.money;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;
import java.util.Map;

/**
 * Renders minor units as a human-readable amount for messages and logs, e.g. 1013 USD ->
 * {@code $10.13}, 1235 JPY -> {@code ¥1,235}. Not meant for receipts: symbols and grouping are
 * fixed rather than locale-driven.
 */
public final class MoneyFormatter {

  private static final Map<String, String> SYMBOLS =
      Map.of(
          "USD", "$",
          "EUR", "€",
          "GBP", "£",
          "JPY", "¥",
          "CNY", "¥",
          "INR", "₹",
          "KRW", "₩");

  private MoneyFormatter() {}

  public static String format(String currency, long minor) {
    String code = CurrencyTable.normalize(currency);
    int exponent = CurrencyTable.exponent(code);
    String symbol = SYMBOLS.getOrDefault(code, code + " ");

    var pattern = new StringBuilder("#,##0");
    if (exponent > 0) {
      pattern.append('.').append("0".repeat(exponent));
    }
    var formatter =
        new DecimalFormat(pattern.toString(), DecimalFormatSymbols.getInstance(Locale.ROOT));
    String digits = formatter.format(MinorUnitConverter.fromMinor(code, minor).abs());
    return (minor < 0 ? "-" : "") + symbol + digits;
  }
}
