package com.venuelink.adapter.core.error;

import java.time.Duration;

public record VenueFailure(
    String venue,
    int httpStatus,
    String code,
    String message,
    Duration retryAfter,
    String symbol,
    String orderId) {
  public VenueFailure {
    if (venue == null || venue.isBlank()) {
      throw new IllegalArgumentException("venue is required");
    }
    message = message == null || message.isBlank() ? "Unknown " + venue + " error" : message;
  }

  public static VenueFailure of(String venue, int httpStatus, String code, String message) {
    return new VenueFailure(venue, httpStatus, code, message, null, null, null);
  }

  public VenueFailure withRetryAfter(Duration value) {
    return new VenueFailure(venue, httpStatus, code, message, value, symbol, orderId);
  }

  public VenueFailure withContext(String nextSymbol, String nextOrderId) {
    return new VenueFailure(venue, httpStatus, code, message, retryAfter, nextSymbol, nextOrderId);
  }

  public boolean isServerError() {
    return httpStatus >= 500 && httpStatus < 600;
  }

  public String describe() {
    return venue
        + " error status="
        + httpStatus
        + " code="
        + (code == null ? "null" : code)
        + " message="
        + message;
  }
}
