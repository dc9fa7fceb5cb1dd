package io.b2mash.pos.backoffice.refund;

import java.util.UUID;

/**
 * Refund breakdown for one line of a batch, in minor units. {@code subtotalMinor} is the gross
 * line amount less {@code discountMinor}.
 */
public record RefundLineQuote(
    UUID lineItemId,
    int quantity,
    long unitPriceMinor,
    long subtotalMinor,
    long taxMinor,
    long tipMinor,
    long surchargeMinor,
    long discountMinor) {

  public long totalMinor() {
    return subtotalMinor + taxMinor + tipMinor + surchargeMinor;
  }
}
