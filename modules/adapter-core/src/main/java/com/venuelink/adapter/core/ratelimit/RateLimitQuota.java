package com.venuelink.adapter.core.ratelimit;

import java.time.Duration;

public record RateLimitQuota(int limit, Duration window) {
  public RateLimitQuota {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    if (window == null || window.isNegative() || window.isZero()) {
      throw new IllegalArgumentException("window must be > 0");
    }
  }

  public static RateLimitQuota perSecond(int limit) {
    return new RateLimitQuota(limit, Duration.ofSeconds(1));
  }

  public static RateLimitQuota perMinute(int limit) {
    return new RateLimitQuota(limit, Duration.ofMinutes(1));
  }
}
