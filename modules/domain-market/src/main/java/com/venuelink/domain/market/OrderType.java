package com.venuelink.domain.market;

import java.util.Locale;

public enum OrderType {
  MARKET,
  LIMIT,
  STOP,
  STOP_LIMIT,
  TRAILING_STOP,
  OCO;

  public boolean requiresPrice() {
    return this == LIMIT || this == STOP_LIMIT || this == OCO;
  }

  public boolean requiresStopPrice() {
    return this == STOP || this == STOP_LIMIT || this == TRAILING_STOP || this == OCO;
  }

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
