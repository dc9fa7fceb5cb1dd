package io.b2mash.pos.backoffice.refund;

import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import org.springframework.stereotype.Component;

/**
 * Process-local ledger, the default until a database-backed implementation is wired in. Individual
 * reads and appends are thread safe; a validate-then-append sequence is not atomic.
 */
@Component
public class InMemoryRefundLedger implements RefundLedger {

  private final List<RefundRecord> records = new CopyOnWriteArrayList<>();

  @Override
  public List<RefundRecord> findByTransactionId(UUID transactionId) {
    return records.stream().filter(r -> r.transactionId().equals(transactionId)).toList();
  }

  @Override
  public List<RefundRecord> findByLineItemId(UUID lineItemId) {
    return records.stream().filter(r -> r.lineItemId().equals(lineItemId)).toList();
  }

  @Override
  public void append(RefundRecord record) {
    records.add(Objects.requireNonNull(record, "record must not be null"));
  }

  public int size() {
    return records.size();
  }
}
