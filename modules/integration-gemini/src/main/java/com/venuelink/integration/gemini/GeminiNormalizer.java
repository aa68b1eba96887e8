package com.venuelink.integration.gemini;

import com.fasterxml.jackson.databind.JsonNode;
import com.venuelink.adapter.core.normalize.JsonFields;
import com.venuelink.domain.market.Balance;
import com.venuelink.domain.market.BalanceSheet;
import com.venuelink.domain.market.Candle;
import com.venuelink.domain.market.CanonicalSymbol;
import com.venuelink.domain.market.Fee;
import com.venuelink.domain.market.Instrument;
import com.venuelink.domain.market.MarketType;
import com.venuelink.domain.market.Order;
import com.venuelink.domain.market.OrderBookSnapshot;
import com.venuelink.domain.market.OrderSide;
import com.venuelink.domain.market.OrderStatus;
import com.venuelink.domain.market.PriceLevel;
import com.venuelink.domain.market.Ticker;
import com.venuelink.domain.market.Trade;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/** Translates Gemini REST and order event payloads into the canonical model. */
public class GeminiNormalizer {
  private static final int DEFAULT_PRECISION = 8;

  private final JsonFields fields;
  private final GeminiSymbolCodec codec;

  public GeminiNormalizer(JsonFields fields, GeminiSymbolCodec codec) {
    this.fields = Objects.requireNonNull(fields, "fields must not be null");
    this.codec = Objects.requireNonNull(codec, "codec must not be null");
  }

  /** Builds an instrument from {@code /v1/symbols/details/{symbol}}. */
  public Instrument instrument(JsonNode details) {
    String venueSymbol = fields.text(details, "symbol").toLowerCase(Locale.ROOT);
    String base = fields.optionalText(details, "base_currency");
    String quote = fields.optionalText(details, "quote_currency");
    String symbol =
        base != null && quote != null
            ? CanonicalSymbol.of(base, quote).toString()
            : codec.toCanonical(venueSymbol);
    String status = fields.optionalText(details, "status");
    return new Instrument(
        venueSymbol,
        symbol,
        null,
        null,
        status == null || "open".equalsIgnoreCase(status),
        MarketType.SPOT,
        precision(fields.optionalDecimal(details, "quote_increment")),
        precision(fields.optionalDecimal(details, "tick_size")),
        fields.optionalDecimal(details, "min_order_size"),
        null,
        null,
        null);
  }

  public Ticker ticker(JsonNode body, String symbol, Instant fallbackTime) {
    JsonNode volume = body.path("volume");
    CanonicalSymbol canonical = CanonicalSymbol.parse(symbol);
    return new Ticker(
        symbol,
        fields.optionalEpochMillis(volume, "timestamp", fallbackTime),
        null,
        null,
        fields.optionalDecimal(body, "bid"),
        fields.optionalDecimal(body, "ask"),
        fields.optionalDecimal(body, "last"),
        null,
        null,
        null,
        fields.optionalDecimal(volume, canonical.base()),
        null,
        null);
  }

  public OrderBookSnapshot orderBook(JsonNode body, String symbol, Instant timestamp) {
    return new OrderBookSnapshot(
        symbol,
        timestamp,
        levels(fields.array(body, "bids")),
        levels(fields.array(body, "asks")));
  }

  public List<Trade> trades(JsonNode body, String symbol) {
    if (!body.isArray()) {
      throw fields.malformed("Gemini trades payload must be an array");
    }
    List<Trade> trades = new ArrayList<>();
    for (JsonNode item : body) {
      trades.add(
          new Trade(
              fields.text(item, "tid"),
              null,
              fields.epochMillis(item, "timestampms"),
              symbol,
              OrderSide.fromCode(fields.text(item, "type")),
              fields.decimal(item, "price"),
              fields.decimal(item, "amount")));
    }
    trades.sort(Comparator.comparing(Trade::timestamp));
    return trades;
  }

  /** Trade entry from the v2 market data feed, either standalone or inside {@code l2_updates}. */
  public Trade streamTrade(JsonNode item, String symbol) {
    return new Trade(
        fields.text(item, "event_id"),
        null,
        fields.epochMillis(item, "timestamp"),
        symbol,
        OrderSide.fromCode(fields.text(item, "side")),
        fields.decimal(item, "price"),
        fields.decimal(item, "quantity"));
  }

  /** Applies one {@code [side, price, quantity]} entry of an {@code l2_updates} frame. */
  void applyBookChange(OrderBookAccumulator book, JsonNode change) {
    if (!change.isArray() || change.size() < 3) {
      throw fields.malformed("Gemini book change must be [side, price, quantity]");
    }
    BigDecimal price = fields.toDecimal(change.get(1), "price");
    BigDecimal size = fields.toDecimal(change.get(2), "quantity");
    if (price == null || size == null) {
      throw fields.malformed("Gemini book change is missing price or quantity");
    }
    book.apply(OrderSide.fromCode(change.get(0).asText()), price, size);
  }

  /** Gemini candles arrive newest first as {@code [ms, open, high, low, close, volume]}. */
  public List<Candle> candles(JsonNode body) {
    if (!body.isArray()) {
      throw fields.malformed("Gemini candles payload must be an array");
    }
    List<Candle> candles = new ArrayList<>();
    for (JsonNode row : body) {
      if (!row.isArray() || row.size() < 6) {
        throw fields.malformed("Gemini candle must be [time, open, high, low, close, volume]");
      }
      candles.add(
          new Candle(
              Instant.ofEpochMilli(row.get(0).asLong()),
              fields.toDecimal(row.get(1), "open"),
              fields.toDecimal(row.get(2), "high"),
              fields.toDecimal(row.get(3), "low"),
              fields.toDecimal(row.get(4), "close"),
              fields.toDecimal(row.get(5), "volume")));
    }
    candles.sort(Comparator.comparing(Candle::openTime));
    return candles;
  }

  public BalanceSheet balances(JsonNode body, Instant timestamp) {
    if (!body.isArray()) {
      throw fields.malformed("Gemini balances payload must be an array");
    }
    List<Balance> balances = new ArrayList<>();
    for (JsonNode item : body) {
      BigDecimal total = fields.decimalOrZero(item, "amount");
      BigDecimal available = fields.decimalOrZero(item, "available");
      BigDecimal used = total.subtract(available).max(BigDecimal.ZERO);
      balances.add(Balance.of(fields.text(item, "currency"), available, used));
    }
    return BalanceSheet.of(timestamp, balances);
  }

  /** Reads both REST order status bodies and order event entries. */
  public Order order(JsonNode body, Instant fallbackTime) {
    String eventType = fields.optionalText(body, "type");
    String venueType = fields.optionalText(body, "order_type");
    if (venueType == null) {
      venueType = eventType;
      eventType = null;
    }
    BigDecimal filled = fields.decimalOrZero(body, "executed_amount");
    BigDecimal original = fields.optionalDecimal(body, "original_amount");
    BigDecimal amount = original == null ? filled : original.max(filled);
    BigDecimal remaining = fields.optionalDecimal(body, "remaining_amount");
    boolean live = body.path("is_live").asBoolean(false);
    boolean cancelled = body.path("is_cancelled").asBoolean(false);
    boolean rejected = "rejected".equalsIgnoreCase(eventType);
    OrderStatus status =
        GeminiMappings.orderStatus(
            live,
            cancelled,
            rejected,
            filled.signum() > 0,
            remaining == null ? amount.compareTo(filled) > 0 : remaining.signum() > 0);
    BigDecimal price = fields.optionalDecimal(body, "price");
    BigDecimal feeAmount = fields.optionalDecimal(body.path("fill"), "fee");
    Instant createdAt = fields.optionalEpochMillis(body, "timestampms", fallbackTime);
    return new Order(
        fields.text(body, "order_id"),
        fields.optionalText(body, "client_order_id"),
        codec.toCanonical(fields.text(body, "symbol")),
        GeminiMappings.orderType(venueType),
        OrderSide.fromCode(fields.text(body, "side")),
        price == null || price.signum() == 0 ? null : price,
        fields.optionalDecimal(body, "stop_price"),
        amount,
        filled,
        null,
        positiveOrNull(fields.optionalDecimal(body, "avg_execution_price")),
        status,
        eventType == null || "initial".equalsIgnoreCase(eventType)
            ? venueStatus(live, cancelled)
            : eventType,
        feeAmount == null
            ? null
            : new Fee(feeAmount, fields.optionalText(body.path("fill"), "fee_currency")),
        createdAt,
        createdAt,
        body.toString());
  }

  public List<Order> orders(JsonNode body, Instant fallbackTime) {
    if (!body.isArray()) {
      throw fields.malformed("Gemini orders payload must be an array");
    }
    List<Order> orders = new ArrayList<>();
    for (JsonNode item : body) {
      orders.add(order(item, fallbackTime));
    }
    return orders;
  }

  private List<PriceLevel> levels(JsonNode rows) {
    List<PriceLevel> levels = new ArrayList<>(rows.size());
    for (JsonNode row : rows) {
      levels.add(PriceLevel.of(fields.decimal(row, "price"), fields.decimal(row, "amount")));
    }
    return levels;
  }

  private static String venueStatus(boolean live, boolean cancelled) {
    if (cancelled) {
      return "cancelled";
    }
    return live ? "live" : "closed";
  }

  private static int precision(BigDecimal increment) {
    if (increment == null || increment.signum() <= 0) {
      return DEFAULT_PRECISION;
    }
    return Math.max(0, increment.stripTrailingZeros().scale());
  }

  private static BigDecimal positiveOrNull(BigDecimal value) {
    return value == null || value.signum() == 0 ? null : value;
  }
}
