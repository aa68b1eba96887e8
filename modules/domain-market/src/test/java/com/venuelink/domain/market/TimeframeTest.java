package com.venuelink.domain.market;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class TimeframeTest {
  @Test
  void shouldDistinguishMinuteFromMonth() {
    assertEquals(Timeframe.ONE_MINUTE, Timeframe.fromCode("1m"));
    assertEquals(Timeframe.ONE_MONTH, Timeframe.fromCode("1M"));
    assertEquals(Duration.ofHours(4), Timeframe.fromCode("4h").duration());
  }

  @Test
  void shouldRejectUnknownTimeframe() {
    assertThrows(IllegalArgumentException.class, () -> Timeframe.fromCode("2h"));
  }
}
