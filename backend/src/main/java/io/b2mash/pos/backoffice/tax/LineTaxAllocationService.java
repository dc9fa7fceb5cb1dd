package io.b2mash.pos.backoffice.tax;

import io.b2mash.pos.backoffice.money.MinorSumValidator;
import io.b2mash.pos.backoffice.money.MinorUnitConverter;
import io.b2mash.pos.backoffice.money.MoneyProperties;
import io.b2mash.pos.backoffice.money.MoneyQuantizer;
import io.b2mash.pos.backoffice.order.OrderLine;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

/**
 * Computes tax per order line in minor units and aggregates the order tax as the sum of the line
 * taxes.
 *
 * <p>Each line is discounted by the order's proportional discount, quantized, multiplied by its
 * effective rate (product rate if set, else the location default) and quantized again. The order
 * total is never recomputed from the undiscounted subtotal, so the per-line figures and the order
 * figure cannot disagree.
 */
@Service
@EnableConfigurationProperties(MoneyProperties.class)
public class LineTaxAllocationService {

  private static final Logger log = LoggerFactory.getLogger(LineTaxAllocationService.class);

  private final MoneyProperties moneyProperties;

  public LineTaxAllocationService(MoneyProperties moneyProperties) {
    this.moneyProperties = moneyProperties;
  }

  /**
   * Computes and stores the tax of every line.
   *
   * @param currency order currency; null falls back to the configured default
   * @param lines the order lines; each line's tax snapshot is overwritten
   * @param discountFraction share of the subtotal removed by discounts, in [0, 1]; null means none
   * @param location selling location; null means no tax configuration, in which case the tax is
   *     zero and no line is touched
   * @return the line records and their sum
   */
  public LineTaxSummary computeLineTaxes(
      String currency,
      List<OrderLine> lines,
      BigDecimal discountFraction,
      SellingLocation location) {
    Objects.requireNonNull(lines, "lines must not be null");
    String resolvedCurrency = moneyProperties.currencyOrDefault(currency);

    if (location == null) {
      log.debug("No selling location configured, skipping tax for {} lines", lines.size());
      return LineTaxSummary.untaxed(resolvedCurrency);
    }

    BigDecimal fraction = discountFraction != null ? discountFraction : BigDecimal.ZERO;
    if (fraction.signum() < 0 || fraction.compareTo(BigDecimal.ONE) > 0) {
      throw new IllegalArgumentException(
          "discountFraction must be between 0 and 1, got " + discountFraction);
    }
    BigDecimal keptFraction = BigDecimal.ONE.subtract(fraction);

    List<LineTaxRecord> records = new ArrayList<>(lines.size());
    long[] lineTaxes = new long[lines.size()];
    for (int i = 0; i < lines.size(); i++) {
      OrderLine line = lines.get(i);
      BigDecimal taxable =
          MoneyQuantizer.quantize(resolvedCurrency, line.lineTotal().multiply(keptFraction));
      BigDecimal rate = effectiveRate(line, location);
      // quantize the taxable amount first, then the tax, so the stored figure matches a receipt
      long taxMinor = MinorUnitConverter.toMinor(resolvedCurrency, taxable.multiply(rate));

      var record = new LineTaxRecord(line.getId(), resolvedCurrency, taxable, rate, taxMinor);
      line.applyTax(record);
      records.add(record);
      lineTaxes[i] = taxMinor;
    }

    long totalTaxMinor = 0L;
    for (long lineTax : lineTaxes) {
      totalTaxMinor = Math.addExact(totalTaxMinor, lineTax);
    }
    MinorSumValidator.validate(
        lines.stream().mapToLong(OrderLine::taxMinor).toArray(),
        totalTaxMinor,
        "stored line taxes vs order tax");

    log.debug(
        "Allocated tax across {} lines: location={}, discountFraction={}, totalTaxMinor={} {}",
        lines.size(),
        location.name(),
        fraction,
        totalTaxMinor,
        resolvedCurrency);
    return new LineTaxSummary(resolvedCurrency, records, totalTaxMinor);
  }

  /**
   * Computes subtotal, discount, tax and grand total for an order, taxing each line on its share
   * of the discounted subtotal.
   *
   * @param discountTotal order-level discount amount; null means none. Capped at the subtotal.
   */
  public OrderTotals calculateTotals(
      String currency, List<OrderLine> lines, BigDecimal discountTotal, SellingLocation location) {
    Objects.requireNonNull(lines, "lines must not be null");
    String resolvedCurrency = moneyProperties.currencyOrDefault(currency);

    // lines are rounded one by one, matching the taxable amounts and the refund path
    BigDecimal subtotal =
        lines.stream()
            .map(line -> MoneyQuantizer.quantize(resolvedCurrency, line.lineTotal()))
            .reduce(MoneyQuantizer.quantize(resolvedCurrency, 0L), BigDecimal::add);
    BigDecimal discount =
        MoneyQuantizer.quantize(
                resolvedCurrency, discountTotal != null ? discountTotal : BigDecimal.ZERO)
            .max(BigDecimal.ZERO.setScale(subtotal.scale()))
            .min(subtotal);
    BigDecimal postDiscountSubtotal = subtotal.subtract(discount);

    LineTaxSummary summary =
        computeLineTaxes(
            resolvedCurrency, lines, discountFraction(subtotal, postDiscountSubtotal), location);
    BigDecimal taxTotal = summary.totalTax();
    int itemCount = lines.stream().mapToInt(OrderLine::getQuantity).sum();

    return new OrderTotals(
        resolvedCurrency,
        subtotal,
        discount,
        taxTotal,
        postDiscountSubtotal.add(taxTotal),
        itemCount,
        location != null);
  }

  /**
   * Share of {@code subtotal} removed by discounts. Zero when the subtotal is not positive or no
   * discount applies; one when the discount swallows the whole subtotal.
   */
  public static BigDecimal discountFraction(BigDecimal subtotal, BigDecimal postDiscountSubtotal) {
    if (subtotal == null
        || postDiscountSubtotal == null
        || subtotal.signum() <= 0
        || postDiscountSubtotal.compareTo(subtotal) >= 0) {
      return BigDecimal.ZERO;
    }
    if (postDiscountSubtotal.signum() <= 0) {
      return BigDecimal.ONE;
    }
    return subtotal.subtract(postDiscountSubtotal).divide(subtotal, MathContext.DECIMAL128);
  }

  private static BigDecimal effectiveRate(OrderLine line, SellingLocation location) {
    return line.getProductTaxRate() != null
        ? line.getProductTaxRate()
        : location.defaultTaxRate();
  }
}
