package io.b2mash.pos.backoffice.refund;

import io.b2mash.pos.backoffice.money.MinorUnitConverter;
import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Refund amounts for a batch of lines. Each component is an exact minor-unit integer and equals
 * the sum of the corresponding line components; {@code totalMinor} is the sum of the four
 * components.
 *
 * @param completesTransaction true when, after this batch, every unit of the transaction has been
 *     refunded
 */
public record RefundQuote(
    UUID transactionId,
    String currency,
    List<RefundLineQuote> lines,
    long subtotalMinor,
    long taxMinor,
    long tipMinor,
    long surchargeMinor,
    long totalMinor,
    boolean completesTransaction) {

  public RefundQuote {
    lines = List.copyOf(lines);
  }

  public BigDecimal subtotal() {
    return MinorUnitConverter.fromMinor(currency, subtotalMinor);
  }

  public BigDecimal tax() {
    return MinorUnitConverter.fromMinor(currency, taxMinor);
  }

  public BigDecimal tip() {
    return MinorUnitConverter.fromMinor(currency, tipMinor);
  }

  public BigDecimal surcharge() {
    return MinorUnitConverter.fromMinor(currency, surchargeMinor);
  }

  public BigDecimal total() {
    return MinorUnitConverter.fromMinor(currency, totalMinor);
  }
}
