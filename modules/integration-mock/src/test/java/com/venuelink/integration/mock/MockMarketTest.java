package com.venuelink.integration.mock;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.venuelink.domain.market.Candle;
import com.venuelink.domain.market.OrderBookSnapshot;
import com.venuelink.domain.market.Timeframe;
import com.venuelink.domain.market.Trade;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class MockMarketTest {
  private static final Instant NOW = Instant.parse("2024-03-01T10:17:30Z");

  private final MockMarket market = new MockMarket(MockConfig.DEFAULT_PRICES, new Random(7L), NOW);

  @Test
  void shouldBuildTwentyLevelsInPointOnePercentSteps() {
    OrderBookSnapshot book = market.orderBook("ETH/USD", NOW);

    assertEquals(MockMarket.BOOK_LEVELS, book.bids().size());
    assertEquals(MockMarket.BOOK_LEVELS, book.asks().size());
    assertEquals(0, new BigDecimal("2997").compareTo(book.bids().get(0).price()));
    assertEquals(0, new BigDecimal("3003").compareTo(book.asks().get(0).price()));
    BigDecimal step = book.bids().get(0).price().subtract(book.bids().get(1).price());
    assertEquals(0, new BigDecimal("2.997").compareTo(step));
  }

  @Test
  void shouldKeepPriceWithinHalfPercentPerTick() {
    BigDecimal before = market.price("BTC/USD");

    market.tick("BTC/USD", NOW.plusSeconds(1));

    BigDecimal move =
        market.price("BTC/USD").subtract(before).abs().divide(before, 8, RoundingMode.HALF_UP);
    assertTrue(move.compareTo(new BigDecimal("0.005")) <= 0, "moved " + move);
  }

  @Test
  void shouldCapTapeAtOneHundredTrades() {
    Trade latest = null;
    for (int i = 1; i <= 5; i++) {
      latest = market.tick("LTC/USD", NOW.plusSeconds(i));
    }

    List<Trade> trades = market.trades("LTC/USD");
    assertEquals(MockMarket.RECENT_TRADES, trades.size());
    assertEquals(latest, trades.get(trades.size() - 1));
  }

  @Test
  void shouldAlignCandlesToTimeframeBuckets() {
    List<Candle> candles = market.candles("BTC/USD", Timeframe.ONE_HOUR, 24, NOW);

    assertEquals(24, candles.size());
    assertEquals(Instant.parse("2024-03-01T10:00:00Z"), candles.get(23).openTime());
    assertEquals(Instant.parse("2024-02-29T11:00:00Z"), candles.get(0).openTime());
    for (Candle candle : candles) {
      assertTrue(candle.high().compareTo(candle.open().max(candle.close())) >= 0);
      assertTrue(candle.low().compareTo(candle.open().min(candle.close())) <= 0);
    }
  }
}
