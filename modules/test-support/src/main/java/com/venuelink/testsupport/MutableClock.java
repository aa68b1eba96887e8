package com.venuelink.testsupport;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

public final class MutableClock extends Clock {
  private final AtomicReference<Instant> current;
  private final ZoneId zone;

  public MutableClock(Instant start) {
    this(start, ZoneOffset.UTC);
  }

  private MutableClock(Instant start, ZoneId zone) {
    this.current = new AtomicReference<>(Objects.requireNonNull(start, "start must not be null"));
    this.zone = zone;
  }

  public static MutableClock startingAt(String isoInstant) {
    return new MutableClock(Instant.parse(isoInstant));
  }

  public Instant advance(Duration step) {
    if (step.isNegative()) {
      throw new IllegalArgumentException("step must be >= 0");
    }
    return current.updateAndGet(value -> value.plus(step));
  }

  public void set(Instant value) {
    current.set(Objects.requireNonNull(value, "value must not be null"));
  }

  @Override
  public ZoneId getZone() {
    return zone;
  }

  @Override
  public Clock withZone(ZoneId value) {
    return new MutableClock(current.get(), value);
  }

  @Override
  public Instant instant() {
    return current.get();
  }
}
