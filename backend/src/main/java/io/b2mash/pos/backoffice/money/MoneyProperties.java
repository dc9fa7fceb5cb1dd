package io.b2mash.pos.backoffice.money;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Money engine settings.
 *
 * @param defaultCurrency currency used when an order or transaction does not carry one
 */
@Validated
@ConfigurationProperties(prefix = "pos.money")
public record MoneyProperties(
    @NotBlank @Size(min = 3, max = 3) @DefaultValue("USD") String defaultCurrency) {

  /** Returns {@code currency} when set, otherwise the configured default. */
  public String currencyOrDefault(String currency) {
    return currency == null || currency.isBlank() ? defaultCurrency : currency;
  }
}
