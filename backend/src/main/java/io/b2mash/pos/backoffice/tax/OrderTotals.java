package io.b2mash.pos.backoffice.tax;

import java.math.BigDecimal;

/**
 * Order-level figures for display and for charging. Tips and surcharges are payment-level
 * amounts and are not part of the grand total.
 *
 * @param subtotal sum of line totals before discounts
 * @param discountTotal order-level discount, capped at the subtotal
 * @param taxTotal sum of per-line taxes
 * @param grandTotal {@code subtotal - discountTotal + taxTotal}
 * @param itemCount sum of line quantities
 * @param hasLocation whether a selling location (and therefore tax) was configured
 */
public record OrderTotals(
    String currency,
    BigDecimal subtotal,
    BigDecimal discountTotal,
    BigDecimal taxTotal,
    BigDecimal grandTotal,
    int itemCount,
    boolean hasLocation) {}
