package com.venuelink.adapter.core.event;

public enum EventKind {
  CONNECTED("connected"),
  DISCONNECTED("disconnected"),
  ERROR("error"),
  MARKET_UPDATE("market_update"),
  ORDER_UPDATE("order_update");

  private final String code;

  EventKind(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }
}
