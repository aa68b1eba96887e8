package com.venuelink.adapter.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

public record HealthStatus(
    String venue,
    boolean healthy,
    ConnectionState connectionState,
    boolean sandbox,
    boolean testMode,
    Duration latency,
    String detail,
    Instant checkedAt) {
  public HealthStatus {
    Objects.requireNonNull(venue, "venue must not be null");
    Objects.requireNonNull(connectionState, "connectionState must not be null");
    latency = latency == null ? Duration.ZERO : latency;
    detail = detail == null ? "" : detail;
    Objects.requireNonNull(checkedAt, "checkedAt must not be null");
  }
}
