package com.venuelink.adapter.core;

import java.util.Locale;

public enum AdapterCapability {
  SPOT_TRADING,
  MARGIN_TRADING,
  FUTURES_TRADING,
  OPTIONS_TRADING,
  WEBSOCKET_MARKET_DATA,
  WEBSOCKET_ACCOUNT_DATA,
  ORDER_BOOK_STREAMING,
  REAL_TIME_TRADES,
  HISTORICAL_DATA,
  PAPER_TRADING,
  ADVANCED_ORDERS,
  STOP_ORDERS,
  TRAILING_STOPS,
  OCO_ORDERS;

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
