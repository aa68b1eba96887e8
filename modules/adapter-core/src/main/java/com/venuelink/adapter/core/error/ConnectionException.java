package com.venuelink.adapter.core.error;

public class ConnectionException extends ExchangeException {
  public ConnectionException(String venue, String message) {
    this(venue, message, null);
  }

  public ConnectionException(String venue, String message, Throwable cause) {
    super(venue, ErrorKind.CONNECTION, message, cause);
  }
}
