package io.b2mash.pos.backoffice.tax;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Tax computed for one order line.
 *
 * @param lineId the order line this record belongs to
 * @param currency ISO 4217 code the amounts are expressed in
 * @param taxableAmount discounted, quantized line amount the rate was applied to
 * @param taxRate effective rate as a fraction
 * @param taxMinor tax in minor units
 */
public record LineTaxRecord(
    UUID lineId, String currency, BigDecimal taxableAmount, BigDecimal taxRate, long taxMinor) {}
