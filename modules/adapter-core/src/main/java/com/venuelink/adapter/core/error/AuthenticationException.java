package com.venuelink.adapter.core.error;

public class AuthenticationException extends ExchangeException {
  public AuthenticationException(String venue, String message) {
    super(venue, ErrorKind.AUTHENTICATION, message, null);
  }
}
