package com.venuelink.adapter.core.error;

import java.util.Optional;

public class OrderException extends ExchangeException {
  private final String orderId;

  public OrderException(String venue, String message) {
    this(venue, message, null);
  }

  public OrderException(String venue, String message, String orderId) {
    super(venue, ErrorKind.ORDER, message, null);
    this.orderId = orderId;
  }

  public Optional<String> orderId() {
    return Optional.ofNullable(orderId);
  }
}
