package com.venuelink.adapter.core.retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;

/** Reads a {@code Retry-After} header given either as delta seconds or as an HTTP date. */
public class RetryAfterParser {
  private final Clock clock;

  public RetryAfterParser(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  public Optional<Duration> parse(String headerValue) {
    if (headerValue == null || headerValue.isBlank()) {
      return Optional.empty();
    }
    String value = headerValue.trim();
    return isDigits(value) ? deltaSeconds(value) : httpDate(value);
  }

  private Optional<Duration> deltaSeconds(String value) {
    if (value.length() > 18) {
      return Optional.empty();
    }
    return Optional.of(Duration.ofSeconds(Long.parseLong(value)));
  }

  private Optional<Duration> httpDate(String value) {
    Instant retryAt;
    try {
      retryAt = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
    } catch (DateTimeParseException ex) {
      return Optional.empty();
    }
    Duration wait = Duration.between(clock.instant(), retryAt);
    return Optional.of(wait.isNegative() ? Duration.ZERO : wait);
  }

  private static boolean isDigits(String value) {
    return value.chars().allMatch(ch -> ch >= '0' && ch <= '9');
  }
}
