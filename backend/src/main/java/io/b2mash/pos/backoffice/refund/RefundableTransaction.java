package io.b2mash.pos.backoffice.refund;

import io.b2mash.pos.backoffice.order.OrderLine;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * A successful payment transaction that refunds are drawn from. All amounts are minor units of
 * {@code currency}.
 *
 * @param status payment state of the order; only {@code PAID} and {@code PARTIALLY_REFUNDED}
 *     transactions can be refunded
 * @param amountMinor goods amount charged: line subtotals minus {@code discountMinor} plus {@code
 *     taxMinor}
 * @param taxMinor order tax. Lines without a tax snapshot share whatever part of it the taxed
 *     lines do not account for.
 * @param tipMinor tip collected with the payment
 * @param surchargeMinor payment-method surcharge collected with the payment
 * @param discountMinor order-level discount already netted out of {@code amountMinor}
 * @param lines the order lines the transaction paid for, with their persisted tax snapshots
 */
public record RefundableTransaction(
    UUID id,
    String currency,
    PaymentStatus status,
    long amountMinor,
    long taxMinor,
    long tipMinor,
    long surchargeMinor,
    long discountMinor,
    List<OrderLine> lines) {

  public RefundableTransaction {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(status, "status must not be null");
    requireNonNegative("amountMinor", amountMinor);
    requireNonNegative("taxMinor", taxMinor);
    requireNonNegative("tipMinor", tipMinor);
    requireNonNegative("surchargeMinor", surchargeMinor);
    requireNonNegative("discountMinor", discountMinor);
    lines = List.copyOf(lines);
    long storedTax = storedLineTax(lines);
    if (taxMinor < storedTax) {
      throw new IllegalArgumentException(
          "taxMinor " + taxMinor + " is less than the stored line taxes " + storedTax);
    }
  }

  /** A paid transaction whose order tax is exactly the sum of its line tax snapshots. */
  public RefundableTransaction(
      UUID id,
      String currency,
      long amountMinor,
      long tipMinor,
      long surchargeMinor,
      long discountMinor,
      List<OrderLine> lines) {
    this(
        id,
        currency,
        PaymentStatus.PAID,
        amountMinor,
        storedLineTax(lines),
        tipMinor,
        surchargeMinor,
        discountMinor,
        lines);
  }

  /** A paid transaction without an order-level discount. */
  public RefundableTransaction(
      UUID id,
      String currency,
      long amountMinor,
      long tipMinor,
      long surchargeMinor,
      List<OrderLine> lines) {
    this(id, currency, amountMinor, tipMinor, surchargeMinor, 0L, lines);
  }

  public Optional<OrderLine> line(UUID lineItemId) {
    return lines.stream().filter(line -> line.getId().equals(lineItemId)).findFirst();
  }

  /** Everything the customer paid: goods, tip and surcharge. */
  public long collectedMinor() {
    return Math.addExact(Math.addExact(amountMinor, tipMinor), surchargeMinor);
  }

  private static long storedLineTax(List<OrderLine> lines) {
    Objects.requireNonNull(lines, "lines must not be null");
    return lines.stream().mapToLong(OrderLine::taxMinor).sum();
  }

  private static void requireNonNegative(String name, long value) {
    if (value < 0) {
      throw new IllegalArgumentException(name + " must not be negative, got " + value);
    }
  }
}
