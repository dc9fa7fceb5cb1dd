package io.b2mash.pos.backoffice.tax;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Tax configuration of the store location an order was sold at.
 *
 * @param name location name, for logs
 * @param defaultTaxRate rate applied to lines without a product-specific rate, as a fraction
 */
public record SellingLocation(String name, BigDecimal defaultTaxRate) {

  public SellingLocation {
    Objects.requireNonNull(defaultTaxRate, "defaultTaxRate must not be null");
    if (defaultTaxRate.signum() < 0) {
      throw new IllegalArgumentException(
          "defaultTaxRate must not be negative, got " + defaultTaxRate);
    }
  }
}
