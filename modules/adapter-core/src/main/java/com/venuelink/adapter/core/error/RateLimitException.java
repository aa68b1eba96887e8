package com.venuelink.adapter.core.error;

import java.time.Duration;

public class RateLimitException extends ExchangeException {
  private final Duration retryAfter;

  public RateLimitException(String venue, String message, Duration retryAfter) {
    super(venue, ErrorKind.RATE_LIMIT, message, null);
    this.retryAfter =
        retryAfter == null || retryAfter.isNegative() ? Duration.ZERO : retryAfter;
  }

  public Duration retryAfter() {
    return retryAfter;
  }
}
