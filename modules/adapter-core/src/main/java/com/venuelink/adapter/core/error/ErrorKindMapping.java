package com.venuelink.adapter.core.error;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public final class ErrorKindMapping {
  private final Map<String, ErrorKind> byCode;
  private final Map<Integer, ErrorKind> byStatus;

  public ErrorKindMapping(Map<String, ErrorKind> byCode, Map<Integer, ErrorKind> byStatus) {
    this.byCode = Map.copyOf(Objects.requireNonNull(byCode, "byCode must not be null"));
    this.byStatus = Map.copyOf(Objects.requireNonNull(byStatus, "byStatus must not be null"));
  }

  public Optional<ErrorKind> kindForCode(String code) {
    if (code == null || code.isBlank()) {
      return Optional.empty();
    }
    return Optional.ofNullable(byCode.get(code.trim()));
  }

  public ErrorKind resolve(VenueFailure failure) {
    return kindForCode(failure.code())
        .or(() -> kindForStatus(failure.httpStatus()))
        .orElse(ErrorKind.UNCLASSIFIED);
  }

  public ExchangeException toException(VenueFailure failure) {
    return toException(resolve(failure), failure);
  }

  public static ExchangeException toException(ErrorKind kind, VenueFailure failure) {
    String venue = failure.venue();
    String message = failure.describe();
    return switch (kind) {
      case CONNECTION -> new ConnectionException(venue, message);
      case AUTHENTICATION -> new AuthenticationException(venue, message);
      case RATE_LIMIT -> new RateLimitException(venue, message, failure.retryAfter());
      case ORDER -> new OrderException(venue, message, failure.orderId());
      case INSUFFICIENT_FUNDS -> new InsufficientFundsException(venue, message);
      case INVALID_SYMBOL -> new InvalidSymbolException(venue, failure.symbol(), message);
      case UNCLASSIFIED -> new UnclassifiedExchangeException(venue, message, null);
    };
  }

  private Optional<ErrorKind> kindForStatus(int status) {
    ErrorKind exact = byStatus.get(status);
    if (exact != null) {
      return Optional.of(exact);
    }
    if (status >= 500 && status < 600) {
      return Optional.of(ErrorKind.CONNECTION);
    }
    return Optional.empty();
  }
}
