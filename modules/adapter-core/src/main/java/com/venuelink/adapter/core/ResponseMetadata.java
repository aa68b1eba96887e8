package com.venuelink.adapter.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

public record ResponseMetadata(
    String venue, String requestId, Duration latency, int rateLimitRemaining, Instant timestamp) {
  public ResponseMetadata {
    Objects.requireNonNull(venue, "venue must not be null");
    Objects.requireNonNull(requestId, "requestId must not be null");
    latency = latency == null || latency.isNegative() ? Duration.ZERO : latency;
    Objects.requireNonNull(timestamp, "timestamp must not be null");
  }
}
