package com.venuelink.adapter.core.error;

public class MalformedPayloadException extends UnclassifiedExchangeException {
  public MalformedPayloadException(String venue, String message) {
    this(venue, message, null);
  }

  public MalformedPayloadException(String venue, String message, Throwable cause) {
    super(venue, message, cause);
  }
}
