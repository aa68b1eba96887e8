package com.venuelink.domain.market;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

public record Candle(
    Instant openTime,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    BigDecimal volume) {
  public Candle {
    Objects.requireNonNull(openTime, "openTime must not be null");
    DomainChecks.requireNonNegative(open, "open");
    DomainChecks.requireNonNegative(high, "high");
    DomainChecks.requireNonNegative(low, "low");
    DomainChecks.requireNonNegative(close, "close");
    DomainChecks.requireNonNegative(volume, "volume");
    if (high.compareTo(low) < 0) {
      throw new MarketDomainException("high must be >= low");
    }
  }
}
