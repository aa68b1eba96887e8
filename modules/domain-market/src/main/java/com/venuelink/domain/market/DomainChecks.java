package com.venuelink.domain.market;

import java.math.BigDecimal;

final class DomainChecks {
  private DomainChecks() {}

  static String requireNonBlank(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new MarketDomainException(fieldName + " must not be blank");
    }
    return value;
  }

  static BigDecimal requireNonNegative(BigDecimal value, String fieldName) {
    if (value == null) {
      throw new MarketDomainException(fieldName + " must not be null");
    }
    if (value.signum() < 0) {
      throw new MarketDomainException(fieldName + " must be >= 0");
    }
    return value;
  }

  static BigDecimal requirePositive(BigDecimal value, String fieldName) {
    if (value == null || value.signum() <= 0) {
      throw new MarketDomainException(fieldName + " must be > 0");
    }
    return value;
  }

  static void requireOptionalNonNegative(BigDecimal value, String fieldName) {
    if (value != null && value.signum() < 0) {
      throw new MarketDomainException(fieldName + " must be >= 0");
    }
  }
}
