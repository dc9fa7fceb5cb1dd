package io.b2mash.pos.backoffice.order;

import io.b2mash.pos.backoffice.tax.LineTaxRecord;
import java.math.BigDecimal;
import java.util.Objects;
import java.util.UUID;

/**
 * A finalized order line as handed to the money engine by the order service. Prices are snapshots
 * taken at sale time (modifiers included); the engine never reprices a line.
 */
public class OrderLine {

  private final UUID id;
  private final String description;
  private final BigDecimal unitPrice;
  private final int quantity;

  /** Product-specific rate as a fraction (0.0825 = 8.25%); null means the location default. */
  private final BigDecimal productTaxRate;

  // --- Tax snapshot, written by LineTaxAllocationService only ---

  private LineTaxRecord taxRecord;

  public OrderLine(
      UUID id, String description, BigDecimal unitPrice, int quantity, BigDecimal productTaxRate) {
    this.id = Objects.requireNonNull(id, "id must not be null");
    this.description = description;
    this.unitPrice = Objects.requireNonNull(unitPrice, "unitPrice must not be null");
    if (unitPrice.signum() < 0) {
      throw new IllegalArgumentException("unitPrice must not be negative, got " + unitPrice);
    }
    if (quantity <= 0) {
      throw new IllegalArgumentException("quantity must be positive, got " + quantity);
    }
    if (productTaxRate != null && productTaxRate.signum() < 0) {
      throw new IllegalArgumentException(
          "productTaxRate must not be negative, got " + productTaxRate);
    }
    this.quantity = quantity;
    this.productTaxRate = productTaxRate;
  }

  public OrderLine(UUID id, String description, BigDecimal unitPrice, int quantity) {
    this(id, description, unitPrice, quantity, null);
  }

  /** Unquantized line total, {@code unitPrice * quantity}. */
  public BigDecimal lineTotal() {
    return unitPrice.multiply(BigDecimal.valueOf(quantity));
  }

  /** Replaces the tax snapshot. Stale values from an earlier discount or item set are dropped. */
  public void applyTax(LineTaxRecord record) {
    Objects.requireNonNull(record, "record must not be null");
    if (!record.lineId().equals(id)) {
      throw new IllegalArgumentException(
          "Tax record for line " + record.lineId() + " applied to line " + id);
    }
    this.taxRecord = record;
  }

  public void clearTax() {
    this.taxRecord = null;
  }

  public boolean isTaxed() {
    return taxRecord != null;
  }

  /** Persisted tax in minor units, or zero when the line has never been taxed. */
  public long taxMinor() {
    return taxRecord != null ? taxRecord.taxMinor() : 0L;
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public String getDescription() {
    return description;
  }

  public BigDecimal getUnitPrice() {
    return unitPrice;
  }

  public int getQuantity() {
    return quantity;
  }

  public BigDecimal getProductTaxRate() {
    return productTaxRate;
  }

  public LineTaxRecord getTaxRecord() {
    return taxRecord;
  }
}
