package com.venuelink.integration.gemini;

import com.venuelink.adapter.core.error.OrderException;
import com.venuelink.domain.market.MarketDomainException;
import com.venuelink.domain.market.OrderStatus;
import com.venuelink.domain.market.OrderType;
import com.venuelink.domain.market.TimeInForce;
import com.venuelink.domain.market.Timeframe;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

final class GeminiMappings {
  private static final Map<Timeframe, String> TIMEFRAMES = new EnumMap<>(Timeframe.class);

  static {
    TIMEFRAMES.put(Timeframe.ONE_MINUTE, "1m");
    TIMEFRAMES.put(Timeframe.FIVE_MINUTES, "5m");
    TIMEFRAMES.put(Timeframe.FIFTEEN_MINUTES, "15m");
    TIMEFRAMES.put(Timeframe.THIRTY_MINUTES, "30m");
    TIMEFRAMES.put(Timeframe.ONE_HOUR, "1hr");
    TIMEFRAMES.put(Timeframe.SIX_HOURS, "6hr");
    TIMEFRAMES.put(Timeframe.ONE_DAY, "1day");
  }

  private GeminiMappings() {}

  static String venueOrderType(OrderType type) {
    return switch (type) {
      case MARKET -> "exchange market";
      case LIMIT -> "exchange limit";
      case STOP_LIMIT -> "exchange stop limit";
      case STOP, TRAILING_STOP, OCO ->
          throw new OrderException(
              GeminiExchangeAdapter.VENUE_ID, "Gemini does not support " + type.code() + " orders");
    };
  }

  static OrderType orderType(String venueType) {
    if (venueType == null || venueType.isBlank()) {
      throw new MarketDomainException("Gemini order type is missing");
    }
    return switch (venueType.trim().toLowerCase(Locale.ROOT)) {
      case "exchange market", "market buy", "market sell" -> OrderType.MARKET;
      case "exchange limit", "limit" -> OrderType.LIMIT;
      case "exchange stop limit", "stop-limit" -> OrderType.STOP_LIMIT;
      default -> throw new MarketDomainException("Unknown Gemini order type: " + venueType);
    };
  }

  /** Returns null for good-till-cancel, which Gemini expresses by sending no option. */
  static String executionOption(TimeInForce timeInForce) {
    return switch (timeInForce) {
      case GTC -> null;
      case IOC -> "immediate-or-cancel";
      case FOK -> "fill-or-kill";
      case POST_ONLY -> "maker-or-cancel";
    };
  }

  static OrderStatus orderStatus(
      boolean live, boolean cancelled, boolean rejected, boolean filledAny, boolean remaining) {
    if (rejected) {
      return OrderStatus.REJECTED;
    }
    if (cancelled) {
      return OrderStatus.CANCELED;
    }
    if (live) {
      return filledAny ? OrderStatus.PARTIALLY_FILLED : OrderStatus.OPEN;
    }
    if (!remaining && filledAny) {
      return OrderStatus.FILLED;
    }
    return OrderStatus.UNKNOWN;
  }

  static String timeframe(Timeframe timeframe) {
    String code = TIMEFRAMES.get(timeframe);
    if (code == null) {
      throw new IllegalArgumentException("Gemini does not support timeframe " + timeframe);
    }
    return code;
  }
}
