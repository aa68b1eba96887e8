package com.venuelink.adapter.core.signing;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

public class NonceSource {
  private final Clock clock;
  private final AtomicLong last = new AtomicLong(0L);

  public NonceSource(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  public long next() {
    long now = clock.millis();
    return last.updateAndGet(previous -> Math.max(now, previous + 1));
  }
}
