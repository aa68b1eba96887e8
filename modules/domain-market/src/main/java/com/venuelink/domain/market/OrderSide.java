package com.venuelink.domain.market;

import java.util.Locale;

public enum OrderSide {
  BUY,
  SELL;

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static OrderSide fromCode(String value) {
    if (value == null || value.isBlank()) {
      throw new MarketDomainException("side must not be blank");
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "buy", "bid" -> BUY;
      case "sell", "ask" -> SELL;
      default -> throw new MarketDomainException("Unknown order side: " + value);
    };
  }
}
