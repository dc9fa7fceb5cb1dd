package io.b2mash.pos.backoffice.refund;

import java.util.UUID;

/** Request to refund {@code quantity} units of one order line. */
public record RefundRequest(UUID lineItemId, int quantity) {}
