package io.b2mash.pos.backoffice.refund;

import java.util.List;
import java.util.UUID;

/**
 * Append-only store of {@link RefundRecord}s. Implementations backed by a database must let the
 * caller run the read of prior refunds and the append of new ones in one transaction, holding a
 * lock on the affected line items; otherwise two concurrent partial refunds can both pass
 * validation.
 */
public interface RefundLedger {

  List<RefundRecord> findByTransactionId(UUID transactionId);

  List<RefundRecord> findByLineItemId(UUID lineItemId);

  void append(RefundRecord record);

  /** Total units already refunded from a line. */
  default int refundedQuantity(UUID lineItemId) {
    return findByLineItemId(lineItemId).stream().mapToInt(RefundRecord::quantityRefunded).sum();
  }
}
