package com.venuelink.integration.cryptocom;

import com.venuelink.adapter.core.error.OrderException;
import com.venuelink.domain.market.MarketDomainException;
import com.venuelink.domain.market.OrderStatus;
import com.venuelink.domain.market.OrderType;
import com.venuelink.domain.market.TimeInForce;
import com.venuelink.domain.market.Timeframe;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

final class CryptoComMappings {
  static final String POST_ONLY = "POST_ONLY";

  private static final Map<Timeframe, String> TIMEFRAMES = new EnumMap<>(Timeframe.class);

  static {
    TIMEFRAMES.put(Timeframe.ONE_MINUTE, "1m");
    TIMEFRAMES.put(Timeframe.FIVE_MINUTES, "5m");
    TIMEFRAMES.put(Timeframe.FIFTEEN_MINUTES, "15m");
    TIMEFRAMES.put(Timeframe.THIRTY_MINUTES, "30m");
    TIMEFRAMES.put(Timeframe.ONE_HOUR, "1h");
    TIMEFRAMES.put(Timeframe.FOUR_HOURS, "4h");
    TIMEFRAMES.put(Timeframe.SIX_HOURS, "6h");
    TIMEFRAMES.put(Timeframe.TWELVE_HOURS, "12h");
    TIMEFRAMES.put(Timeframe.ONE_DAY, "1D");
    TIMEFRAMES.put(Timeframe.ONE_WEEK, "1W");
    TIMEFRAMES.put(Timeframe.ONE_MONTH, "1M");
  }

  private CryptoComMappings() {}

  static OrderStatus orderStatus(String venueStatus) {
    if (venueStatus == null || venueStatus.isBlank()) {
      return OrderStatus.UNKNOWN;
    }
    return switch (venueStatus.trim().toUpperCase(Locale.ROOT)) {
      case "ACTIVE", "PENDING" -> OrderStatus.OPEN;
      case "FILLED" -> OrderStatus.FILLED;
      case "CANCELED", "CANCELLED" -> OrderStatus.CANCELED;
      case "REJECTED" -> OrderStatus.REJECTED;
      case "EXPIRED" -> OrderStatus.EXPIRED;
      default -> OrderStatus.UNKNOWN;
    };
  }

  static String venueOrderType(OrderType type) {
    return switch (type) {
      case MARKET -> "MARKET";
      case LIMIT -> "LIMIT";
      case STOP -> "STOP_LOSS";
      case STOP_LIMIT -> "STOP_LIMIT";
      case TRAILING_STOP, OCO ->
          throw new OrderException(
              CryptoComExchangeAdapter.VENUE_ID,
              "Crypto.com does not support " + type.code() + " orders");
    };
  }

  static OrderType orderType(String venueType) {
    if (venueType == null || venueType.isBlank()) {
      throw new MarketDomainException("Crypto.com order type is missing");
    }
    return switch (venueType.trim().toUpperCase(Locale.ROOT)) {
      case "MARKET" -> OrderType.MARKET;
      case "LIMIT" -> OrderType.LIMIT;
      case "STOP_LOSS", "TAKE_PROFIT" -> OrderType.STOP;
      case "STOP_LIMIT", "TAKE_PROFIT_LIMIT" -> OrderType.STOP_LIMIT;
      default -> throw new MarketDomainException("Unknown Crypto.com order type: " + venueType);
    };
  }

  /** Returns null for post-only orders, which travel as {@code exec_inst} instead. */
  static String timeInForce(TimeInForce timeInForce) {
    return switch (timeInForce) {
      case GTC -> "GOOD_TILL_CANCEL";
      case IOC -> "IMMEDIATE_OR_CANCEL";
      case FOK -> "FILL_OR_KILL";
      case POST_ONLY -> null;
    };
  }

  static String timeframe(Timeframe timeframe) {
    String code = TIMEFRAMES.get(timeframe);
    if (code == null) {
      throw new IllegalArgumentException("Crypto.com does not support timeframe " + timeframe);
    }
    return code;
  }
}
