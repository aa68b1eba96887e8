package com.venuelink.domain.market;

import java.util.Locale;

public enum OrderStatus {
  PENDING("pending"),
  OPEN("open"),
  PARTIALLY_FILLED("partially_filled"),
  FILLED("closed"),
  CANCELED("canceled"),
  REJECTED("rejected"),
  EXPIRED("expired"),
  UNKNOWN("unknown");

  private final String code;

  OrderStatus(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public boolean isTerminal() {
    return this == FILLED || this == CANCELED || this == REJECTED || this == EXPIRED;
  }

  public static OrderStatus fromCode(String value) {
    if (value == null || value.isBlank()) {
      return UNKNOWN;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "pending" -> PENDING;
      case "open" -> OPEN;
      case "partially_filled" -> PARTIALLY_FILLED;
      case "closed", "filled" -> FILLED;
      case "canceled", "cancelled" -> CANCELED;
      case "rejected" -> REJECTED;
      case "expired" -> EXPIRED;
      default -> UNKNOWN;
    };
  }
}
