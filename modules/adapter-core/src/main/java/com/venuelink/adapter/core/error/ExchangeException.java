package com.venuelink.adapter.core.error;

import java.util.Objects;

public abstract class ExchangeException extends RuntimeException {
  private final String venue;
  private final ErrorKind kind;

  protected ExchangeException(String venue, ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.venue = venue;
    this.kind = Objects.requireNonNull(kind, "kind must not be null");
  }

  public String venue() {
    return venue;
  }

  public ErrorKind kind() {
    return kind;
  }
}
