package com.venuelink.domain.market;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

public record Ticker(
    String symbol,
    Instant timestamp,
    BigDecimal high,
    BigDecimal low,
    BigDecimal bid,
    BigDecimal ask,
    BigDecimal last,
    BigDecimal close,
    BigDecimal bidVolume,
    BigDecimal askVolume,
    BigDecimal baseVolume,
    BigDecimal change,
    BigDecimal percentChange)
    implements MarketPayload {
  public Ticker {
    symbol = CanonicalSymbol.parse(symbol).toString();
    Objects.requireNonNull(timestamp, "timestamp must not be null");
    DomainChecks.requireOptionalNonNegative(bid, "bid");
    DomainChecks.requireOptionalNonNegative(ask, "ask");
    DomainChecks.requireOptionalNonNegative(last, "last");
    if (close == null) {
      close = last;
    }
  }
}
