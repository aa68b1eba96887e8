package com.venuelink.domain.market;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

public record Trade(
    String id,
    String orderId,
    Instant timestamp,
    String symbol,
    OrderSide side,
    BigDecimal price,
    BigDecimal amount)
    implements MarketPayload {
  public Trade {
    DomainChecks.requireNonBlank(id, "id");
    Objects.requireNonNull(timestamp, "timestamp must not be null");
    symbol = CanonicalSymbol.parse(symbol).toString();
    Objects.requireNonNull(side, "side must not be null");
    DomainChecks.requireNonNegative(price, "price");
    DomainChecks.requireNonNegative(amount, "amount");
  }

  public BigDecimal cost() {
    return price.multiply(amount);
  }
}
