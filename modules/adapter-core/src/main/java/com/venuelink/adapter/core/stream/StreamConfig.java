package com.venuelink.adapter.core.stream;

import java.net.URI;
import java.time.Duration;

public record StreamConfig(
    URI uri,
    Duration connectTimeout,
    Duration openDelay,
    Duration reconnectBaseBackoff,
    Duration reconnectMaxBackoff,
    boolean reconnectEnabled) {
  public StreamConfig {
    if (uri == null) {
      throw new IllegalArgumentException("uri is required");
    }
    if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero()) {
      throw new IllegalArgumentException("connectTimeout must be > 0");
    }
    openDelay = openDelay == null ? Duration.ZERO : openDelay;
    if (openDelay.isNegative()) {
      throw new IllegalArgumentException("openDelay must be >= 0");
    }
    if (reconnectBaseBackoff == null
        || reconnectBaseBackoff.isNegative()
        || reconnectBaseBackoff.isZero()) {
      throw new IllegalArgumentException("reconnectBaseBackoff must be > 0");
    }
    if (reconnectMaxBackoff == null || reconnectMaxBackoff.compareTo(reconnectBaseBackoff) < 0) {
      throw new IllegalArgumentException("reconnectMaxBackoff must be >= reconnectBaseBackoff");
    }
  }

  public static StreamConfig of(URI uri) {
    return new StreamConfig(
        uri,
        Duration.ofSeconds(10),
        Duration.ZERO,
        Duration.ofSeconds(1),
        Duration.ofSeconds(30),
        true);
  }

  public StreamConfig withUri(URI value) {
    return new StreamConfig(
        value,
        connectTimeout,
        openDelay,
        reconnectBaseBackoff,
        reconnectMaxBackoff,
        reconnectEnabled);
  }

  public StreamConfig withOpenDelay(Duration value) {
    return new StreamConfig(
        uri, connectTimeout, value, reconnectBaseBackoff, reconnectMaxBackoff, reconnectEnabled);
  }

  public StreamConfig withReconnectBackoff(Duration base, Duration max) {
    return new StreamConfig(uri, connectTimeout, openDelay, base, max, reconnectEnabled);
  }
}
