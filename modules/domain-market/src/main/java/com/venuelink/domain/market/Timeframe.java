package com.venuelink.domain.market;

import java.time.Duration;

public enum Timeframe {
  ONE_MINUTE("1m", Duration.ofMinutes(1)),
  FIVE_MINUTES("5m", Duration.ofMinutes(5)),
  FIFTEEN_MINUTES("15m", Duration.ofMinutes(15)),
  THIRTY_MINUTES("30m", Duration.ofMinutes(30)),
  ONE_HOUR("1h", Duration.ofHours(1)),
  FOUR_HOURS("4h", Duration.ofHours(4)),
  SIX_HOURS("6h", Duration.ofHours(6)),
  TWELVE_HOURS("12h", Duration.ofHours(12)),
  ONE_DAY("1d", Duration.ofDays(1)),
  ONE_WEEK("1w", Duration.ofDays(7)),
  ONE_MONTH("1M", Duration.ofDays(30));

  private final String code;
  private final Duration duration;

  Timeframe(String code, Duration duration) {
    this.code = code;
    this.duration = duration;
  }

  public String code() {
    return code;
  }

  public Duration duration() {
    return duration;
  }

  // Case matters: "1m" is a minute, "1M" a month.
  public static Timeframe fromCode(String code) {
    if (code != null) {
      String candidate = code.trim();
      for (Timeframe timeframe : values()) {
        if (timeframe.code.equals(candidate)) {
          return timeframe;
        }
      }
    }
    throw new IllegalArgumentException("Unsupported timeframe: " + code);
  }
}
