package io.b2mash.pos.backoffice.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a refund batch cannot be applied, e.g. a quantity exceeds what is still refundable
 * on a line. The whole batch is rejected. Results in HTTP 422 Unprocessable Entity; the problem
 * carries the offending line and the requested and available quantities.
 */
public class RefundValidationFailedException extends ErrorResponseException {

  private final UUID lineItemId;
  private final int requestedQuantity;
  private final int availableQuantity;

  public RefundValidationFailedException(
      String detail,
      UUID lineItemId,
      int requestedQuantity,
      int availableQuantity,
      int alreadyRefunded) {
    super(
        HttpStatus.UNPROCESSABLE_ENTITY,
        createProblem(detail, lineItemId, requestedQuantity, availableQuantity, alreadyRefunded),
        null);
    this.lineItemId = lineItemId;
    this.requestedQuantity = requestedQuantity;
    this.availableQuantity = availableQuantity;
  }

  /** A failure that is not tied to a single line, such as an empty batch. */
  public RefundValidationFailedException(String detail) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, createProblem(detail), null);
    this.lineItemId = null;
    this.requestedQuantity = 0;
    this.availableQuantity = 0;
  }

  public UUID getLineItemId() {
    return lineItemId;
  }

  public int getRequestedQuantity() {
    return requestedQuantity;
  }

  public int getAvailableQuantity() {
    return availableQuantity;
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle("Refund validation failed");
    problem.setDetail(detail);
    return problem;
  }

  private static ProblemDetail createProblem(
      String detail,
      UUID lineItemId,
      int requestedQuantity,
      int availableQuantity,
      int alreadyRefunded) {
    var problem = createProblem(detail);
    problem.setProperty("lineItemId", lineItemId);
    problem.setProperty("requestedQuantity", requestedQuantity);
    problem.setProperty("availableQuantity", availableQuantity);
    problem.setProperty("alreadyRefunded", alreadyRefunded);
    return problem;
  }
}
