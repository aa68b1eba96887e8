package com.venuelink.adapter.core;

import java.time.Clock;
import java.time.Duration;

public record AdapterSettings(
    boolean sandbox, Duration timeout, boolean testMode, Credentials credentials, Clock clock) {
  public AdapterSettings {
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be > 0");
    }
    credentials = credentials == null ? Credentials.none() : credentials;
    if (clock == null) {
      throw new IllegalArgumentException("clock is required");
    }
  }

  public static AdapterSettings defaults(Credentials credentials) {
    return new AdapterSettings(
        false, Duration.ofSeconds(30), false, credentials, Clock.systemUTC());
  }
}
