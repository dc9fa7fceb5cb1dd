package io.b2mash.pos.backoffice.refund;

/** Payment state of the order a transaction belongs to, as reported by the payment service. */
public enum PaymentStatus {
  UNPAID,
  PAID,
  PARTIALLY_REFUNDED,
  REFUNDED,
  CANCELLED
}
