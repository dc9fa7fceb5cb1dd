package io.b2mash.pos.backoffice.tax;

import io.b2mash.pos.backoffice.money.MinorUnitConverter;
import java.math.BigDecimal;
import java.util.List;

/**
 * Result of a per-line tax pass. {@code totalTaxMinor} is by construction the sum of the line
 * records; there is no separately computed order-level figure.
 */
public record LineTaxSummary(String currency, List<LineTaxRecord> lines, long totalTaxMinor) {

  public LineTaxSummary {
    lines = List.copyOf(lines);
  }

  /** Summary for an order sold without any tax configuration: no lines, zero tax. */
  static LineTaxSummary untaxed(String currency) {
    return new LineTaxSummary(currency, List.of(), 0L);
  }

  public BigDecimal totalTax() {
    return MinorUnitConverter.fromMinor(currency, totalTaxMinor);
  }
}
