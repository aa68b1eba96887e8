package com.venuelink.integration.gemini;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.venuelink.adapter.core.error.MalformedPayloadException;
import com.venuelink.adapter.core.normalize.JsonFields;
import com.venuelink.domain.market.Balance;
import com.venuelink.domain.market.Candle;
import com.venuelink.domain.market.Instrument;
import com.venuelink.domain.market.Order;
import com.venuelink.domain.market.OrderBookSnapshot;
import com.venuelink.domain.market.OrderStatus;
import com.venuelink.domain.market.OrderType;
import com.venuelink.domain.market.Ticker;
import com.venuelink.domain.market.Trade;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class GeminiNormalizerTest {
  private static final Instant NOW = Instant.parse("2024-03-01T00:00:00Z");

  private final JsonFields fields = new JsonFields("gemini", new ObjectMapper());
  private final GeminiNormalizer normalizer = new GeminiNormalizer(fields, new GeminiSymbolCodec());

  @Test
  void shouldBuildInstrumentFromSymbolDetails() {
    Instrument instrument =
        normalizer.instrument(
            json(
                "{\"symbol\":\"BTCUSD\",\"base_currency\":\"BTC\",\"quote_currency\":\"USD\","
                    + "\"tick_size\":1E-8,\"quote_increment\":0.01,"
                    + "\"min_order_size\":\"0.00001\",\"status\":\"open\"}"));

    assertEquals("btcusd", instrument.venueSymbol());
    assertEquals("BTC/USD", instrument.symbol());
    assertEquals(2, instrument.pricePrecision());
    assertEquals(8, instrument.amountPrecision());
    assertEquals(new BigDecimal("0.00001"), instrument.minAmount());
    assertTrue(instrument.active());
  }

  @Test
  void shouldMarkClosedSymbolsInactive() {
    Instrument instrument =
        normalizer.instrument(
            json(
                "{\"symbol\":\"LUNAUST\",\"base_currency\":\"LUNA\",\"quote_currency\":\"UST\","
                    + "\"status\":\"closed\"}"));

    assertEquals("LUNA/UST", instrument.symbol());
    assertFalse(instrument.active());
  }

  @Test
  void shouldReadTickerVolumeForBaseAsset() {
    Ticker ticker =
        normalizer.ticker(
            json(
                "{\"bid\":\"49990\",\"ask\":\"50010\",\"last\":\"50000\",\"volume\":{"
                    + "\"BTC\":\"12.5\",\"USD\":\"625000\",\"timestamp\":1709251200000}}"),
            "BTC/USD",
            NOW);

    assertEquals(new BigDecimal("12.5"), ticker.baseVolume());
    assertEquals(new BigDecimal("50000"), ticker.close());
    assertEquals(Instant.ofEpochMilli(1709251200000L), ticker.timestamp());
    assertNull(ticker.high());
  }

  @Test
  void shouldNormalizeBookLevels() {
    OrderBookSnapshot book =
        normalizer.orderBook(
            json(
                "{\"bids\":[{\"price\":\"3000\",\"amount\":\"1\",\"timestamp\":\"1709251200\"},"
                    + "{\"price\":\"2999\",\"amount\":\"2\",\"timestamp\":\"1709251200\"}],"
                    + "\"asks\":[{\"price\":\"3001\",\"amount\":\"0.5\",\"timestamp\":\"1\"}]}"),
            "ETH/USD",
            NOW);

    assertEquals(new BigDecimal("3000"), book.bestBid().orElseThrow().price());
    assertEquals(new BigDecimal("0.5"), book.bestAsk().orElseThrow().size());
  }

  @Test
  void shouldSortTradesAndCandlesOldestFirst() {
    List<Trade> trades =
        normalizer.trades(
            json(
                "[{\"tid\":2,\"timestampms\":1709251260000,\"type\":\"sell\",\"price\":\"2\","
                    + "\"amount\":\"1\"},{\"tid\":1,\"timestampms\":1709251200000,"
                    + "\"type\":\"buy\",\"price\":\"1\",\"amount\":\"1\"}]"),
            "BTC/USD");
    List<Candle> candles =
        normalizer.candles(json("[[1709337600000,2,3,1,2,10],[1709251200000,1,2,1,2,5.5]]"));

    assertEquals(List.of("1", "2"), trades.stream().map(Trade::id).toList());
    assertTrue(candles.get(0).openTime().isBefore(candles.get(1).openTime()));
    assertEquals(new BigDecimal("5.5"), candles.get(0).volume());
  }

  @Test
  void shouldDeriveUsedBalanceFromAmountMinusAvailable() {
    Balance usd =
        normalizer
            .balances(
                json(
                    "[{\"type\":\"exchange\",\"currency\":\"USD\",\"amount\":\"1000\","
                        + "\"available\":\"750\"}]"),
                NOW)
            .balance("USD");

    assertEquals(new BigDecimal("750"), usd.free());
    assertEquals(new BigDecimal("250"), usd.used());
  }

  @Test
  void shouldDeriveOrderStatusFromFlags() {
    assertEquals(OrderStatus.OPEN, order(true, false, "0", "1").status());
    assertEquals(OrderStatus.PARTIALLY_FILLED, order(true, false, "0.4", "0.6").status());
    assertEquals(OrderStatus.FILLED, order(false, false, "1", "0").status());
    assertEquals(OrderStatus.CANCELED, order(false, true, "0.4", "0.6").status());
    assertEquals("cancelled", order(false, true, "0", "1").venueStatus());
  }

  @Test
  void shouldReadOrderEventsWithEventType() {
    Order order =
        normalizer.order(
            json(
                "{\"type\":\"rejected\",\"order_id\":\"7\",\"symbol\":\"btcusd\","
                    + "\"side\":\"buy\",\"order_type\":\"exchange limit\","
                    + "\"timestampms\":1709251200000,\"is_live\":false,\"is_cancelled\":false,"
                    + "\"original_amount\":\"1\",\"price\":\"50000\",\"reason\":\"InvalidPrice\"}"),
            NOW);

    assertEquals(OrderStatus.REJECTED, order.status());
    assertEquals("rejected", order.venueStatus());
    assertEquals(OrderType.LIMIT, order.type());
    assertEquals(new BigDecimal("1"), order.remaining());
  }

  @Test
  void shouldFailClosedOnMissingOrderId() {
    assertThrows(
        MalformedPayloadException.class,
        () ->
            normalizer.order(
                json("{\"symbol\":\"btcusd\",\"side\":\"buy\",\"type\":\"exchange limit\"}"),
                NOW));
  }

  private Order order(boolean live, boolean cancelled, String executed, String remaining) {
    return normalizer.order(
        json(
            "{\"order_id\":\"1\",\"symbol\":\"btcusd\",\"side\":\"buy\","
                + "\"type\":\"exchange limit\",\"price\":\"50000\",\"original_amount\":\"1\","
                + "\"executed_amount\":\""
                + executed
                + "\",\"remaining_amount\":\""
                + remaining
                + "\",\"is_live\":"
                + live
                + ",\"is_cancelled\":"
                + cancelled
                + ",\"timestampms\":1709251200000}"),
        NOW);
  }

  private JsonNode json(String body) {
    return fields.parse(body);
  }
}
