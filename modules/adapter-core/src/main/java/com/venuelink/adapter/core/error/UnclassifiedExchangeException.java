package com.venuelink.adapter.core.error;

public class UnclassifiedExchangeException extends ExchangeException {
  public UnclassifiedExchangeException(String venue, String message, Throwable cause) {
    super(venue, ErrorKind.UNCLASSIFIED, message, cause);
  }
}
