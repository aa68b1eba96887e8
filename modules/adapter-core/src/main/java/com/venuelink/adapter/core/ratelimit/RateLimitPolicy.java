package com.venuelink.adapter.core.ratelimit;

import com.venuelink.adapter.core.RequestClass;
import java.time.Clock;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

public record RateLimitPolicy(RateLimitQuota publicQuota, RateLimitQuota privateQuota) {
  public RateLimitPolicy {
    Objects.requireNonNull(publicQuota, "publicQuota must not be null");
    Objects.requireNonNull(privateQuota, "privateQuota must not be null");
  }

  public static RateLimitPolicy shared(RateLimitQuota quota) {
    return new RateLimitPolicy(quota, quota);
  }

  public RateLimitQuota quota(RequestClass requestClass) {
    return requestClass == RequestClass.PRIVATE ? privateQuota : publicQuota;
  }

  public Map<RequestClass, SlidingWindowRateLimiter> createLimiters(String venue, Clock clock) {
    Map<RequestClass, SlidingWindowRateLimiter> limiters = new EnumMap<>(RequestClass.class);
    for (RequestClass requestClass : RequestClass.values()) {
      RateLimitQuota quota = quota(requestClass);
      limiters.put(
          requestClass,
          new SlidingWindowRateLimiter(
              venue,
              requestClass.name().toLowerCase(Locale.ROOT),
              quota.limit(),
              quota.window(),
              clock));
    }
    return limiters;
  }
}
