package com.venuelink.adapter.core;

public enum MarketChannel {
  TICKER("ticker"),
  ORDER_BOOK("orderbook"),
  TRADES("trades");

  private final String code;

  MarketChannel(String code) {
    this.code = code;
  }

  /** Channel name carried by {@code MarketUpdate} events. */
  public String code() {
    return code;
  }
}
