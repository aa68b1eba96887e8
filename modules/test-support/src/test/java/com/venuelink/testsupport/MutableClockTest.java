package com.venuelink.testsupport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class MutableClockTest {
  @Test
  void shouldAdvanceAndReset() {
    MutableClock clock = MutableClock.startingAt("2026-03-01T00:00:00Z");

    clock.advance(Duration.ofMillis(1500));
    assertEquals(Instant.parse("2026-03-01T00:00:01.500Z"), clock.instant());

    clock.set(Instant.parse("2026-03-02T00:00:00Z"));
    assertEquals(Instant.parse("2026-03-02T00:00:00Z"), clock.instant());
  }

  @Test
  void shouldRejectNegativeStep() {
    MutableClock clock = MutableClock.startingAt("2026-03-01T00:00:00Z");

    assertThrows(IllegalArgumentException.class, () -> clock.advance(Duration.ofSeconds(-1)));
  }
}
