package com.venuelink.domain.market;

import java.math.BigDecimal;

public record PriceLevel(BigDecimal price, BigDecimal size, Integer orderCount) {
  public PriceLevel {
    DomainChecks.requireNonNegative(price, "price");
    DomainChecks.requireNonNegative(size, "size");
    if (orderCount != null && orderCount < 0) {
      throw new MarketDomainException("orderCount must be >= 0");
    }
  }

  public static PriceLevel of(BigDecimal price, BigDecimal size) {
    return new PriceLevel(price, size, null);
  }
}
