package io.b2mash.pos.backoffice.refund;

import java.util.List;

/** A processed refund: the amounts that were returned and the records appended to the ledger. */
public record RefundResult(RefundQuote quote, List<RefundRecord> records) {

  public RefundResult {
    records = List.copyOf(records);
  }
}
