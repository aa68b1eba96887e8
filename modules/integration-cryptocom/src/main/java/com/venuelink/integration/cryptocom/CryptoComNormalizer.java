package com.venuelink.integration.cryptocom;

import com.fasterxml.jackson.databind.JsonNode;
import com.venuelink.adapter.core.normalize.JsonFields;
import com.venuelink.domain.market.Balance;
import com.venuelink.domain.market.BalanceSheet;
import com.venuelink.domain.market.Candle;
import com.venuelink.domain.market.Fee;
import com.venuelink.domain.market.Instrument;
import com.venuelink.domain.market.MarketType;
import com.venuelink.domain.market.Order;
import com.venuelink.domain.market.OrderBookSnapshot;
import com.venuelink.domain.market.OrderSide;
import com.venuelink.domain.market.OrderStatus;
import com.venuelink.domain.market.OrderType;
import com.venuelink.domain.market.PriceLevel;
import com.venuelink.domain.market.Ticker;
import com.venuelink.domain.market.Trade;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/** Translates Crypto.com {@code result} payloads into the canonical model. */
public class CryptoComNormalizer {
  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
  private static final int DEFAULT_PRECISION = 8;

  private final JsonFields fields;
  private final CryptoComSymbolCodec codec;

  public CryptoComNormalizer(JsonFields fields, CryptoComSymbolCodec codec) {
    this.fields = Objects.requireNonNull(fields, "fields must not be null");
    this.codec = Objects.requireNonNull(codec, "codec must not be null");
  }

  public List<Instrument> instruments(JsonNode result) {
    List<Instrument> instruments = new ArrayList<>();
    for (JsonNode item : fields.array(result, "instruments")) {
      String venueSymbol = fields.text(item, "instrument_name");
      if (!codec.isSpotInstrument(venueSymbol)) {
        continue;
      }
      JsonNode tradable = item.get("tradable");
      instruments.add(
          new Instrument(
              venueSymbol,
              codec.toCanonical(venueSymbol),
              null,
              null,
              tradable == null || tradable.isNull() || tradable.asBoolean(),
              MarketType.SPOT,
              precision(item, "price_decimals"),
              precision(item, "quantity_decimals"),
              fields.optionalDecimal(item, "min_quantity"),
              fields.optionalDecimal(item, "max_quantity"),
              fields.optionalDecimal(item, "min_price"),
              fields.optionalDecimal(item, "max_price")));
    }
    return instruments;
  }

  public Ticker ticker(JsonNode item, Instant fallbackTime) {
    BigDecimal change = fields.optionalDecimal(item, "c");
    return new Ticker(
        codec.toCanonical(fields.text(item, "i")),
        fields.optionalEpochMillis(item, "t", fallbackTime),
        fields.optionalDecimal(item, "h"),
        fields.optionalDecimal(item, "l"),
        fields.optionalDecimal(item, "b"),
        fields.optionalDecimal(item, "k"),
        fields.optionalDecimal(item, "a"),
        null,
        fields.optionalDecimal(item, "bs"),
        fields.optionalDecimal(item, "ks"),
        fields.optionalDecimal(item, "v"),
        null,
        change == null ? null : change.multiply(HUNDRED));
  }

  public OrderBookSnapshot orderBook(JsonNode book, String symbol, Instant fallbackTime) {
    return new OrderBookSnapshot(
        symbol,
        fields.optionalEpochMillis(book, "t", fallbackTime),
        levels(fields.array(book, "bids")),
        levels(fields.array(book, "asks")));
  }

  /** Picks the book out of either a REST {@code result} or a stream {@code result}. */
  public JsonNode bookData(JsonNode result) {
    JsonNode data = result.get("data");
    if (data != null && data.isArray()) {
      if (data.isEmpty()) {
        throw fields.malformed("Crypto.com book payload carried no data");
      }
      return data.get(0);
    }
    return result;
  }

  public Trade trade(JsonNode item, String fallbackSymbol) {
    String venueSymbol = fields.optionalText(item, "i");
    return new Trade(
        fields.text(item, "d"),
        null,
        fields.epochMillis(item, "t"),
        venueSymbol == null ? fallbackSymbol : codec.toCanonical(venueSymbol),
        OrderSide.fromCode(fields.text(item, "s")),
        fields.decimal(item, "p"),
        fields.decimal(item, "q"));
  }

  public List<Trade> trades(JsonNode result, String fallbackSymbol) {
    List<Trade> trades = new ArrayList<>();
    for (JsonNode item : fields.array(result, "data")) {
      trades.add(trade(item, fallbackSymbol));
    }
    trades.sort(Comparator.comparing(Trade::timestamp));
    return trades;
  }

  public List<Candle> candles(JsonNode result) {
    List<Candle> candles = new ArrayList<>();
    for (JsonNode item : fields.array(result, "data")) {
      candles.add(
          new Candle(
              fields.epochMillis(item, "t"),
              fields.decimal(item, "o"),
              fields.decimal(item, "h"),
              fields.decimal(item, "l"),
              fields.decimal(item, "c"),
              fields.decimalOrZero(item, "v")));
    }
    candles.sort(Comparator.comparing(Candle::openTime));
    return candles;
  }

  public BalanceSheet balances(JsonNode result, Instant timestamp) {
    List<Balance> balances = new ArrayList<>();
    for (JsonNode account : fields.array(result, "accounts")) {
      BigDecimal reserved =
          fields.decimalOrZero(account, "order").add(fields.decimalOrZero(account, "stake"));
      balances.add(
          Balance.of(
              fields.text(account, "currency"),
              fields.decimalOrZero(account, "available"),
              reserved));
    }
    return BalanceSheet.of(timestamp, balances);
  }

  public Order order(JsonNode info, Instant fallbackTime) {
    OrderType type = CryptoComMappings.orderType(fields.text(info, "type"));
    BigDecimal filled = fields.decimalOrZero(info, "cumulative_quantity");
    BigDecimal amount = fields.decimalOrZero(info, "quantity").max(filled);
    String venueStatus = fields.optionalText(info, "status");
    OrderStatus status = CryptoComMappings.orderStatus(venueStatus);
    if (status == OrderStatus.OPEN && filled.signum() > 0) {
      status = OrderStatus.PARTIALLY_FILLED;
    }
    BigDecimal price = fields.optionalDecimal(info, "price");
    BigDecimal feeAmount = fields.optionalDecimal(info, "cumulative_fee");
    Instant createdAt = fields.optionalEpochMillis(info, "create_time", fallbackTime);
    return new Order(
        fields.text(info, "order_id"),
        fields.optionalText(info, "client_oid"),
        codec.toCanonical(fields.text(info, "instrument_name")),
        type,
        OrderSide.fromCode(fields.text(info, "side")),
        price == null || price.signum() == 0 ? null : price,
        fields.optionalDecimal(info, "trigger_price"),
        amount,
        filled,
        null,
        positiveOrNull(fields.optionalDecimal(info, "avg_price")),
        status,
        venueStatus,
        feeAmount == null ? null : new Fee(feeAmount, fields.optionalText(info, "fee_currency")),
        createdAt,
        fields.optionalEpochMillis(info, "update_time", createdAt),
        info.toString());
  }

  public List<Order> orders(JsonNode result, Instant fallbackTime) {
    List<Order> orders = new ArrayList<>();
    for (JsonNode info : fields.array(result, "order_list")) {
      orders.add(order(info, fallbackTime));
    }
    return orders;
  }

  private List<PriceLevel> levels(JsonNode rows) {
    List<PriceLevel> levels = new ArrayList<>(rows.size());
    for (JsonNode row : rows) {
      if (!row.isArray() || row.size() < 2) {
        throw fields.malformed("Crypto.com book level must be [price, size, count]");
      }
      Integer count = row.size() > 2 && row.get(2).canConvertToInt() ? row.get(2).asInt() : null;
      levels.add(
          new PriceLevel(
              fields.toDecimal(row.get(0), "price"), fields.toDecimal(row.get(1), "size"), count));
    }
    return levels;
  }

  private int precision(JsonNode item, String field) {
    JsonNode value = item.get(field);
    return value == null || !value.canConvertToInt() ? DEFAULT_PRECISION : value.asInt();
  }

  private static BigDecimal positiveOrNull(BigDecimal value) {
    return value == null || value.signum() == 0 ? null : value;
  }
}
