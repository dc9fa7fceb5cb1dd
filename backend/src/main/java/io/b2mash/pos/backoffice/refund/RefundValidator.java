package io.b2mash.pos.backoffice.refund;

import io.b2mash.pos.backoffice.exception.RefundValidationFailedException;
import io.b2mash.pos.backoffice.exception.ResourceNotFoundException;
import io.b2mash.pos.backoffice.order.OrderLine;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Checks a refund batch against the quantities sold and the refund history. Pure: it reads only
 * its arguments, so the caller decides the transaction boundary around it.
 */
public final class RefundValidator {

  private RefundValidator() {}

  /**
   * Validates every request of a batch. Requests for the same line are merged first, so a batch
   * cannot sidestep the limit by splitting a quantity.
   *
   * @return requested quantity per line, in request order
   * @throws RefundValidationFailedException if the payment is not in a refundable state
   * @throws ResourceNotFoundException if a request names a line not on the transaction
   * @throws RefundValidationFailedException on the first invalid request; nothing is applied
   */
  public static Map<UUID, Integer> validate(
      RefundableTransaction transaction,
      List<RefundRequest> requests,
      List<RefundRecord> history) {
    Objects.requireNonNull(transaction, "transaction must not be null");
    checkStatus(transaction.status());
    if (requests == null || requests.isEmpty()) {
      throw new RefundValidationFailedException("No items to refund");
    }

    Map<UUID, Integer> merged = new LinkedHashMap<>();
    for (RefundRequest request : requests) {
      OrderLine line =
          transaction
              .line(request.lineItemId())
              .orElseThrow(() -> new ResourceNotFoundException("OrderLine", request.lineItemId()));
      if (request.quantity() <= 0) {
        throw new RefundValidationFailedException(
            "Quantity must be positive, got " + request.quantity(),
            line.getId(),
            request.quantity(),
            remainingQuantity(line, history),
            refundedQuantity(line.getId(), history));
      }
      merged.merge(line.getId(), request.quantity(), Math::addExact);
    }

    for (var entry : merged.entrySet()) {
      OrderLine line = transaction.line(entry.getKey()).orElseThrow();
      checkQuantity(line, entry.getValue(), history);
    }
    return merged;
  }

  /** Units of {@code line} that can still be refunded given {@code history}. */
  public static int remainingQuantity(OrderLine line, List<RefundRecord> history) {
    return Math.max(0, line.getQuantity() - refundedQuantity(line.getId(), history));
  }

  static int refundedQuantity(UUID lineItemId, List<RefundRecord> history) {
    return history.stream()
        .filter(r -> r.lineItemId().equals(lineItemId))
        .mapToInt(RefundRecord::quantityRefunded)
        .sum();
  }

  private static void checkStatus(PaymentStatus status) {
    switch (status) {
      case UNPAID -> throw new RefundValidationFailedException("Cannot refund unpaid orders");
      case REFUNDED -> throw new RefundValidationFailedException("Payment already fully refunded");
      case CANCELLED ->
          throw new RefundValidationFailedException("Cannot refund items from cancelled orders");
      default -> {}
    }
  }

  private static void checkQuantity(OrderLine line, int quantity, List<RefundRecord> history) {
    int refunded = refundedQuantity(line.getId(), history);
    int remaining = Math.max(0, line.getQuantity() - refunded);

    if (quantity > line.getQuantity()) {
      throw new RefundValidationFailedException(
          "Cannot refund %d units of line %s - only %d ordered"
              .formatted(quantity, line.getId(), line.getQuantity()),
          line.getId(),
          quantity,
          remaining,
          refunded);
    }
    if (remaining == 0) {
      throw new RefundValidationFailedException(
          "Line %s has already been fully refunded (%d of %d units already refunded)"
              .formatted(line.getId(), refunded, line.getQuantity()),
          line.getId(),
          quantity,
          0,
          refunded);
    }
    if (quantity > remaining) {
      throw new RefundValidationFailedException(
          "Only %d units of line %s available to refund (%d already refunded)"
              .formatted(remaining, line.getId(), refunded),
          line.getId(),
          quantity,
          remaining,
          refunded);
    }
  }
}
