package com.venuelink.domain.market;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

public record Position(String asset, BigDecimal amount, BigDecimal entryPrice, Instant timestamp) {
  public Position {
    asset = DomainChecks.requireNonBlank(asset, "asset").trim().toUpperCase(Locale.ROOT);
    DomainChecks.requireNonNegative(amount, "amount");
    DomainChecks.requireOptionalNonNegative(entryPrice, "entryPrice");
    Objects.requireNonNull(timestamp, "timestamp must not be null");
  }
}
