package io.b2mash.pos.backoffice.refund;

import io.b2mash.pos.backoffice.exception.RefundValidationFailedException;
import io.b2mash.pos.backoffice.money.MinorSumValidator;
import io.b2mash.pos.backoffice.money.MinorUnitAllocator;
import io.b2mash.pos.backoffice.money.MinorUnitConverter;
import io.b2mash.pos.backoffice.money.MoneyProperties;
import io.b2mash.pos.backoffice.order.OrderLine;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.ToLongFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Computes item-level refunds with proportional tax, tip, surcharge and discount, and records them
 * in the {@link RefundLedger}.
 *
 * <p>All arithmetic is in minor units:
 *
 * <ul>
 *   <li>subtotal: the rounded line total prorated by quantity, less the line's share of the order
 *       discount
 *   <li>tax: the line's persisted tax prorated by quantity, so it matches what was charged. Lines
 *       without a tax snapshot share the order tax by line amount.
 *   <li>tip, surcharge, discount: the batch's share of the transaction amount by gross subtotal,
 *       spread over the batch lines with {@link MinorUnitAllocator}
 * </ul>
 *
 * <p>Prorated components are capped at what has not yet been refunded, and the refund that takes
 * the last units returns the exact remainder. A series of partial refunds therefore adds up to
 * the amount collected, never more.
 */
@Service
public class RefundAllocationService {

  private static final Logger log = LoggerFactory.getLogger(RefundAllocationService.class);

  private final RefundLedger refundLedger;
  private final MoneyProperties moneyProperties;

  public RefundAllocationService(RefundLedger refundLedger, MoneyProperties moneyProperties) {
    this.refundLedger = refundLedger;
    this.moneyProperties = moneyProperties;
  }

  /**
   * Quotes a refund without recording it.
   *
   * @param history prior refund records of the transaction's lines
   * @throws RefundValidationFailedException if any request is not refundable; nothing is quoted
   */
  public RefundQuote calculateRefund(
      RefundableTransaction transaction,
      List<RefundRequest> requests,
      List<RefundRecord> history) {
    Objects.requireNonNull(history, "history must not be null");
    Map<UUID, Integer> quantities = RefundValidator.validate(transaction, requests, history);
    String currency = moneyProperties.currencyOrDefault(transaction.currency());
    List<RefundRecord> transactionHistory =
        history.stream().filter(r -> r.transactionId().equals(transaction.id())).toList();

    Map<UUID, Long> lineGross = new HashMap<>();
    long orderGross = 0L;
    boolean completes = true;
    for (OrderLine line : transaction.lines()) {
      long gross = lineGrossMinor(currency, line);
      lineGross.put(line.getId(), gross);
      orderGross = Math.addExact(orderGross, gross);
      int remainingAfter =
          RefundValidator.remainingQuantity(line, history)
              - quantities.getOrDefault(line.getId(), 0);
      completes &= remainingAfter == 0;
    }
    if (transaction.discountMinor() > orderGross) {
      throw new IllegalArgumentException(
          "discountMinor %d exceeds the order's line amounts %d"
              .formatted(transaction.discountMinor(), orderGross));
    }
    Map<UUID, Long> lineTax = lineTaxTotals(transaction, lineGross);

    int n = quantities.size();
    List<OrderLine> batchLines = new ArrayList<>(n);
    long[] gross = new long[n];
    long[] tax = new long[n];
    long batchGross = 0L;
    int i = 0;
    for (var entry : quantities.entrySet()) {
      OrderLine line = transaction.line(entry.getKey()).orElseThrow();
      int quantity = entry.getValue();
      batchLines.add(line);
      gross[i] =
          lineShare(
              lineGross.get(line.getId()), line, quantity, history, RefundRecord::grossMinor);
      tax[i] =
          lineShare(lineTax.get(line.getId()), line, quantity, history, RefundRecord::taxMinor);
      batchGross = Math.addExact(batchGross, gross[i]);
      i++;
    }

    long tipMinor =
        transactionShare(
            transaction.tipMinor(),
            transactionHistory,
            RefundRecord::tipMinor,
            batchGross,
            orderGross,
            completes);
    long surchargeMinor =
        transactionShare(
            transaction.surchargeMinor(),
            transactionHistory,
            RefundRecord::surchargeMinor,
            batchGross,
            orderGross,
            completes);
    long discountMinor =
        transactionShare(
            transaction.discountMinor(),
            transactionHistory,
            RefundRecord::discountMinor,
            batchGross,
            orderGross,
            completes);

    long[] spreadWeights =
        weightsOrQuantities(
            gross, batchLines.stream().mapToLong(line -> quantities.get(line.getId())).toArray());
    long[] tips = MinorUnitAllocator.allocate(spreadWeights, tipMinor);
    long[] surcharges = MinorUnitAllocator.allocate(spreadWeights, surchargeMinor);
    long[] discounts = MinorUnitAllocator.allocate(spreadWeights, discountMinor);

    List<RefundLineQuote> lineQuotes = new ArrayList<>(n);
    long subtotalMinor = 0L;
    long taxMinor = 0L;
    long[] lineTotals = new long[n];
    for (int j = 0; j < n; j++) {
      OrderLine line = batchLines.get(j);
      var quote =
          new RefundLineQuote(
              line.getId(),
              quantities.get(line.getId()),
              MinorUnitConverter.toMinor(currency, line.getUnitPrice()),
              gross[j] - discounts[j],
              tax[j],
              tips[j],
              surcharges[j],
              discounts[j]);
      lineQuotes.add(quote);
      lineTotals[j] = quote.totalMinor();
      subtotalMinor += quote.subtotalMinor();
      taxMinor += quote.taxMinor();
    }

    // each component is already an exact integer; the total is their plain sum
    long totalMinor = subtotalMinor + taxMinor + tipMinor + surchargeMinor;
    MinorSumValidator.validate(
        lineTotals, totalMinor, "refund lines of transaction " + transaction.id());

    if (completes) {
      long previouslyRefunded =
          transactionHistory.stream().mapToLong(RefundRecord::totalMinor).sum();
      MinorSumValidator.validate(
          new long[] {previouslyRefunded, totalMinor},
          transaction.collectedMinor(),
          "full refund of transaction " + transaction.id());
    }

    return new RefundQuote(
        transaction.id(),
        currency,
        lineQuotes,
        subtotalMinor,
        taxMinor,
        tipMinor,
        surchargeMinor,
        totalMinor,
        completes);
  }

  /**
   * Validates, quotes and records a refund. One {@link RefundRecord} is appended per line; when
   * validation fails nothing is appended. Must run inside the caller's transaction for the
   * affected lines.
   */
  public RefundResult processRefund(
      RefundableTransaction transaction, List<RefundRequest> requests, String reason) {
    List<RefundRecord> history = refundLedger.findByTransactionId(transaction.id());
    RefundQuote quote;
    try {
      quote = calculateRefund(transaction, requests, history);
    } catch (RefundValidationFailedException e) {
      log.warn(
          "Rejected refund for transaction={}: {}", transaction.id(), e.getBody().getDetail());
      throw e;
    }

    List<RefundRecord> records =
        quote.lines().stream()
            .map(line -> RefundRecord.fromQuote(transaction.id(), line, reason))
            .toList();
    records.forEach(refundLedger::append);

    log.info(
        "Recorded refund for transaction={}: lines={}, totalMinor={} {}, completes={}",
        transaction.id(),
        records.size(),
        quote.totalMinor(),
        quote.currency(),
        quote.completesTransaction());
    return new RefundResult(quote, records);
  }

  /** Quotes the refund of every unit that has not been refunded yet. */
  public RefundQuote previewFullRefund(
      RefundableTransaction transaction, List<RefundRecord> history) {
    List<RefundRequest> requests =
        transaction.lines().stream()
            .map(
                line ->
                    new RefundRequest(
                        line.getId(), RefundValidator.remainingQuantity(line, history)))
            .filter(request -> request.quantity() > 0)
            .toList();
    return calculateRefund(transaction, requests, history);
  }

  /** Ledger-backed variant of {@link #previewFullRefund(RefundableTransaction, List)}. */
  public RefundQuote previewFullRefund(RefundableTransaction transaction) {
    return previewFullRefund(transaction, refundLedger.findByTransactionId(transaction.id()));
  }

  /** Units of {@code line} that can still be refunded according to the ledger. */
  public int remainingRefundableQuantity(OrderLine line) {
    return Math.max(0, line.getQuantity() - refundLedger.refundedQuantity(line.getId()));
  }

  // --- Private helpers ---

  /** Line total rounded once, the same way the tax pass and the order subtotal round it. */
  private static long lineGrossMinor(String currency, OrderLine line) {
    return MinorUnitConverter.toMinor(currency, line.lineTotal());
  }

  /**
   * Tax owed per line. Lines with a tax snapshot use it. Lines without one (orders taxed only at
   * order level) split the order tax the snapshots do not cover, by line amount.
   */
  private static Map<UUID, Long> lineTaxTotals(
      RefundableTransaction transaction, Map<UUID, Long> lineGross) {
    Map<UUID, Long> totals = new HashMap<>();
    List<OrderLine> untaxed = new ArrayList<>();
    long storedTax = 0L;
    for (OrderLine line : transaction.lines()) {
      if (line.isTaxed()) {
        totals.put(line.getId(), line.taxMinor());
        storedTax = Math.addExact(storedTax, line.taxMinor());
      } else {
        untaxed.add(line);
      }
    }
    if (untaxed.isEmpty()) {
      return totals;
    }

    long orderLevelTax = transaction.taxMinor() - storedTax;
    long[] weights =
        weightsOrQuantities(
            untaxed.stream().mapToLong(line -> lineGross.get(line.getId())).toArray(),
            untaxed.stream().mapToLong(OrderLine::getQuantity).toArray());
    long[] shares = MinorUnitAllocator.allocate(weights, orderLevelTax);
    for (int i = 0; i < untaxed.size(); i++) {
      totals.put(untaxed.get(i).getId(), shares[i]);
    }
    log.debug(
        "Prorated order tax over untaxed lines: transaction={}, lines={}, taxMinor={}",
        transaction.id(),
        untaxed.size(),
        orderLevelTax);
    return totals;
  }

  /**
   * A line component scaled by {@code quantity / ordered}, half-even, capped at what is still
   * unrefunded of it. Taking the last units returns that remainder exactly.
   */
  private static long lineShare(
      long lineTotal,
      OrderLine line,
      int quantity,
      List<RefundRecord> history,
      ToLongFunction<RefundRecord> component) {
    long alreadyRefunded =
        history.stream()
            .filter(r -> r.lineItemId().equals(line.getId()))
            .mapToLong(component)
            .sum();
    long unrefunded = Math.max(0L, lineTotal - alreadyRefunded);

    if (quantity == RefundValidator.remainingQuantity(line, history)) {
      return unrefunded;
    }
    long prorated =
        BigDecimal.valueOf(lineTotal)
            .multiply(BigDecimal.valueOf(quantity))
            .divide(BigDecimal.valueOf(line.getQuantity()), 0, RoundingMode.HALF_EVEN)
            .longValueExact();
    return Math.min(prorated, unrefunded);
  }

  /**
   * The batch's share of a transaction-level amount. Partial batches get their largest-remainder
   * share of {@code [batchGross, orderGross - batchGross]}, capped at what is still unrefunded;
   * the completing batch gets the remainder.
   */
  private static long transactionShare(
      long amount,
      List<RefundRecord> transactionHistory,
      ToLongFunction<RefundRecord> component,
      long batchGross,
      long orderGross,
      boolean completes) {
    long alreadyRefunded = transactionHistory.stream().mapToLong(component).sum();
    long unrefunded = Math.max(0L, amount - alreadyRefunded);
    if (completes) {
      return unrefunded;
    }
    return Math.min(MinorUnitAllocator.shareOf(batchGross, orderGross, amount), unrefunded);
  }

  /** {@code amounts} as allocation weights, or {@code quantities} when every amount is zero. */
  private static long[] weightsOrQuantities(long[] amounts, long[] quantities) {
    for (long amount : amounts) {
      if (amount > 0) {
        return amounts;
      }
    }
    return quantities;
  }
}
