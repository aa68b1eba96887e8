package com.venuelink.adapter.core.error;

import java.math.BigDecimal;

public class InsufficientFundsException extends ExchangeException {
  private final String currency;
  private final BigDecimal required;
  private final BigDecimal available;

  public InsufficientFundsException(
      String venue, String currency, BigDecimal required, BigDecimal available) {
    super(
        venue,
        ErrorKind.INSUFFICIENT_FUNDS,
        String.format(
            "Insufficient %s balance: required=%s, available=%s", currency, required, available),
        null);
    this.currency = currency;
    this.required = required;
    this.available = available;
  }

  public InsufficientFundsException(String venue, String message) {
    super(venue, ErrorKind.INSUFFICIENT_FUNDS, message, null);
    this.currency = null;
    this.required = null;
    this.available = null;
  }

  public String currency() {
    return currency;
  }

  public BigDecimal required() {
    return required;
  }

  public BigDecimal available() {
    return available;
  }
}
