package com.venuelink.adapter.core.error;

public class InvalidSymbolException extends ExchangeException {
  private final String symbol;

  public InvalidSymbolException(String venue, String symbol, String message) {
    super(venue, ErrorKind.INVALID_SYMBOL, message, null);
    this.symbol = symbol;
  }

  public String symbol() {
    return symbol;
  }
}
