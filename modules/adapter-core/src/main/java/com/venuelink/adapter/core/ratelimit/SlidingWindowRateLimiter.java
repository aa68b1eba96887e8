package com.venuelink.adapter.core.ratelimit;

import com.venuelink.adapter.core.error.RateLimitException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

public class SlidingWindowRateLimiter {
  private final String venue;
  private final String name;
  private final int limit;
  private final Duration window;
  private final Clock clock;
  private final Deque<Instant> admitted = new ArrayDeque<>();

  public SlidingWindowRateLimiter(
      String venue, String name, int limit, Duration window, Clock clock) {
    if (venue == null || venue.isBlank()) {
      throw new IllegalArgumentException("venue is required");
    }
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    if (window == null || window.isNegative() || window.isZero()) {
      throw new IllegalArgumentException("window must be > 0");
    }
    this.venue = venue;
    this.name = name == null || name.isBlank() ? "default" : name;
    this.limit = limit;
    this.window = window;
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  public synchronized void acquire() {
    Instant now = clock.instant();
    evictExpired(now);
    if (admitted.size() >= limit) {
      Duration retryAfter = Duration.between(now, admitted.peekFirst().plus(window));
      throw new RateLimitException(
          venue,
          "Rate limit exceeded for "
              + venue
              + " "
              + name
              + " requests: limit="
              + limit
              + " window="
              + window,
          retryAfter);
    }
    admitted.addLast(now);
  }

  public synchronized int remaining() {
    evictExpired(clock.instant());
    return limit - admitted.size();
  }

  public String name() {
    return name;
  }

  public int limit() {
    return limit;
  }

  public Duration window() {
    return window;
  }

  private void evictExpired(Instant now) {
    Instant threshold = now.minus(window);
    while (!admitted.isEmpty() && !admitted.peekFirst().isAfter(threshold)) {
      admitted.removeFirst();
    }
  }
}
