package com.venuelink.domain.market;

import java.math.BigDecimal;

public record Fee(BigDecimal amount, String currency) {
  public Fee {
    DomainChecks.requireNonNegative(amount, "amount");
  }
}
