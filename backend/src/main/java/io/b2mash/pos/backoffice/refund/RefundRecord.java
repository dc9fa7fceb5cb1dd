package io.b2mash.pos.backoffice.refund;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable record of units refunded from one order line. Records are only ever appended; a
 * correction is a new record. The sum of {@code quantityRefunded} over a line's records is the
 * authoritative refunded quantity.
 *
 * <p>Amounts are minor units. {@code subtotalMinor} is already net of {@code discountMinor}.
 */
public record RefundRecord(
    UUID id,
    UUID transactionId,
    UUID lineItemId,
    int quantityRefunded,
    long unitPriceMinor,
    long subtotalMinor,
    long taxMinor,
    long tipMinor,
    long surchargeMinor,
    long discountMinor,
    String reason,
    Instant createdAt) {

  public RefundRecord {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(transactionId, "transactionId must not be null");
    Objects.requireNonNull(lineItemId, "lineItemId must not be null");
    Objects.requireNonNull(createdAt, "createdAt must not be null");
    if (quantityRefunded <= 0) {
      throw new IllegalArgumentException(
          "quantityRefunded must be positive, got " + quantityRefunded);
    }
  }

  /** Creates a record for a quoted line with a fresh id and the current instant. */
  static RefundRecord fromQuote(UUID transactionId, RefundLineQuote line, String reason) {
    return new RefundRecord(
        UUID.randomUUID(),
        transactionId,
        line.lineItemId(),
        line.quantity(),
        line.unitPriceMinor(),
        line.subtotalMinor(),
        line.taxMinor(),
        line.tipMinor(),
        line.surchargeMinor(),
        line.discountMinor(),
        reason,
        Instant.now());
  }

  /** Line amount before the discount share, i.e. {@code subtotalMinor + discountMinor}. */
  public long grossMinor() {
    return subtotalMinor + discountMinor;
  }

  /** Subtotal, tax, tip and surcharge returned to the customer. */
  public long totalMinor() {
    return subtotalMinor + taxMinor + tipMinor + surchargeMinor;
  }
}
