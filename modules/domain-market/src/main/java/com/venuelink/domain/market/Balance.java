package com.venuelink.domain.market;

import java.math.BigDecimal;
import java.util.Locale;

public record Balance(String currency, BigDecimal free, BigDecimal used, BigDecimal total) {
  public Balance {
    currency = DomainChecks.requireNonBlank(currency, "currency").trim().toUpperCase(Locale.ROOT);
    DomainChecks.requireNonNegative(free, "free");
    DomainChecks.requireNonNegative(used, "used");
    DomainChecks.requireNonNegative(total, "total");
    if (free.add(used).compareTo(total) != 0) {
      throw new MarketDomainException(
          "free + used must equal total for "
              + currency
              + ": free="
              + free
              + ", used="
              + used
              + ", total="
              + total);
    }
  }

  public static Balance of(String currency, BigDecimal free, BigDecimal used) {
    return new Balance(currency, free, used, free.add(used));
  }

  public static Balance zero(String currency) {
    return new Balance(currency, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
  }
}
