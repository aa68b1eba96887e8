package com.venuelink.adapter.core.error;

public enum ErrorKind {
  CONNECTION("connection_error"),
  AUTHENTICATION("authentication_error"),
  RATE_LIMIT("rate_limit_error"),
  ORDER("order_error"),
  INSUFFICIENT_FUNDS("insufficient_funds_error"),
  INVALID_SYMBOL("invalid_symbol_error"),
  UNCLASSIFIED("exchange_error");

  private final String code;

  ErrorKind(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }
}
