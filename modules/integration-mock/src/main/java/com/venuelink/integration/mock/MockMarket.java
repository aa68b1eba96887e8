package com.venuelink.integration.mock;

import com.venuelink.domain.market.Candle;
import com.venuelink.domain.market.OrderBookSnapshot;
import com.venuelink.domain.market.OrderSide;
import com.venuelink.domain.market.PriceLevel;
import com.venuelink.domain.market.Ticker;
import com.venuelink.domain.market.Timeframe;
import com.venuelink.domain.market.Trade;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/** Random-walk prices with a synthetic book and tape per symbol. */
final class MockMarket {
  static final int BOOK_LEVELS = 20;
  static final int RECENT_TRADES = 100;

  private static final int PRICE_SCALE = 8;
  private static final int SIZE_SCALE = 4;
  private static final BigDecimal BID_FACTOR = new BigDecimal("0.999");
  private static final BigDecimal ASK_FACTOR = new BigDecimal("1.001");
  private static final BigDecimal LEVEL_STEP = new BigDecimal("0.001");
  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

  private final Random random;
  private final Map<String, SymbolState> states = new LinkedHashMap<>();
  private long tradeSequence;

  MockMarket(Map<String, BigDecimal> prices, Random random, Instant now) {
    this.random = random;
    prices.forEach((symbol, price) -> states.put(symbol, seed(symbol, price, now)));
  }

  synchronized Set<String> symbols() {
    return Set.copyOf(states.keySet());
  }

  synchronized BigDecimal price(String symbol) {
    return state(symbol).price;
  }

  synchronized Ticker ticker(String symbol, Instant now) {
    SymbolState state = state(symbol);
    BigDecimal change = state.price.subtract(state.open);
    return new Ticker(
        symbol,
        now,
        state.high,
        state.low,
        bid(state.price),
        ask(state.price),
        state.price,
        null,
        state.bids.get(0).size(),
        state.asks.get(0).size(),
        state.volume,
        change,
        change.multiply(HUNDRED).divide(state.open, 4, RoundingMode.HALF_UP));
  }

  synchronized OrderBookSnapshot orderBook(String symbol, Instant now) {
    SymbolState state = state(symbol);
    return new OrderBookSnapshot(symbol, now, state.bids, state.asks);
  }

  /** Recent trades, oldest first. */
  synchronized List<Trade> trades(String symbol) {
    return List.copyOf(state(symbol).trades);
  }

  /** Synthetic candles around the current price, one per bucket ending with the current one. */
  synchronized List<Candle> candles(String symbol, Timeframe timeframe, int count, Instant now) {
    BigDecimal price = state(symbol).price;
    long bucketMs = timeframe.duration().toMillis();
    long currentBucket = Math.floorDiv(now.toEpochMilli(), bucketMs) * bucketMs;
    List<Candle> candles = new ArrayList<>(count);
    for (int i = count - 1; i >= 0; i--) {
      BigDecimal open = scale(price.multiply(factor(0.05d)));
      BigDecimal close = scale(open.multiply(factor(0.02d)));
      BigDecimal high = scale(open.max(close).multiply(upward(0.01d)));
      BigDecimal low = scale(open.min(close).multiply(downward(0.01d)));
      candles.add(
          new Candle(
              Instant.ofEpochMilli(currentBucket - i * bucketMs),
              open,
              high,
              low,
              close,
              size(random.nextDouble() * 1000)));
    }
    return candles;
  }

  /** Moves the price by up to 0.5% either way, rebuilds the book and prints one trade. */
  synchronized Trade tick(String symbol, Instant now) {
    SymbolState state = state(symbol);
    state.price = scale(state.price.multiply(factor(0.01d)));
    state.high = state.high.max(state.price);
    state.low = state.low.min(state.price);
    rebuildBook(state);
    OrderSide side = random.nextBoolean() ? OrderSide.BUY : OrderSide.SELL;
    Trade trade = trade(symbol, state.price, side, now);
    record(state, trade);
    return trade;
  }

  static BigDecimal bid(BigDecimal price) {
    return scale(price.multiply(BID_FACTOR));
  }

  static BigDecimal ask(BigDecimal price) {
    return scale(price.multiply(ASK_FACTOR));
  }

  private SymbolState seed(String symbol, BigDecimal price, Instant now) {
    SymbolState state = new SymbolState(price);
    rebuildBook(state);
    List<Trade> history = new ArrayList<>(RECENT_TRADES);
    for (int i = 0; i < RECENT_TRADES; i++) {
      BigDecimal tradePrice = scale(price.multiply(factor(0.02d)));
      OrderSide side = random.nextBoolean() ? OrderSide.BUY : OrderSide.SELL;
      history.add(trade(symbol, tradePrice, side, now.minusSeconds(i)));
    }
    Collections.reverse(history);
    history.forEach(trade -> record(state, trade));
    return state;
  }

  private void rebuildBook(SymbolState state) {
    BigDecimal bestBid = bid(state.price);
    BigDecimal bestAsk = ask(state.price);
    BigDecimal bidStep = bestBid.multiply(LEVEL_STEP);
    BigDecimal askStep = bestAsk.multiply(LEVEL_STEP);
    List<PriceLevel> bids = new ArrayList<>(BOOK_LEVELS);
    List<PriceLevel> asks = new ArrayList<>(BOOK_LEVELS);
    for (int level = 0; level < BOOK_LEVELS; level++) {
      BigDecimal offset = BigDecimal.valueOf(level);
      bids.add(
          PriceLevel.of(
              scale(bestBid.subtract(bidStep.multiply(offset))),
              size(random.nextDouble() * 10 + 0.1d)));
      asks.add(
          PriceLevel.of(
              scale(bestAsk.add(askStep.multiply(offset))),
              size(random.nextDouble() * 10 + 0.1d)));
    }
    state.bids = List.copyOf(bids);
    state.asks = List.copyOf(asks);
  }

  private Trade trade(String symbol, BigDecimal price, OrderSide side, Instant at) {
    tradeSequence++;
    return new Trade(
        "mock_trade_" + tradeSequence,
        null,
        at,
        symbol,
        side,
        price,
        size(random.nextDouble() * 5 + 0.01d));
  }

  private static void record(SymbolState state, Trade trade) {
    state.trades.addLast(trade);
    state.volume = state.volume.add(trade.amount());
    while (state.trades.size() > RECENT_TRADES) {
      state.trades.removeFirst();
    }
  }

  private SymbolState state(String symbol) {
    SymbolState state = states.get(symbol);
    if (state == null) {
      throw new IllegalArgumentException("Symbol " + symbol + " is not simulated");
    }
    return state;
  }

  /** {@code 1 + u * width} with {@code u} uniform in {@code [-0.5, 0.5)}. */
  private BigDecimal factor(double width) {
    return BigDecimal.valueOf(1.0d + (random.nextDouble() - 0.5d) * width);
  }

  private BigDecimal upward(double width) {
    return BigDecimal.valueOf(1.0d + random.nextDouble() * width);
  }

  private BigDecimal downward(double width) {
    return BigDecimal.valueOf(1.0d - random.nextDouble() * width);
  }

  private static BigDecimal scale(BigDecimal value) {
    return value.setScale(PRICE_SCALE, RoundingMode.HALF_UP);
  }

  private static BigDecimal size(double value) {
    return BigDecimal.valueOf(value).setScale(SIZE_SCALE, RoundingMode.HALF_UP);
  }

  private static final class SymbolState {
    private final BigDecimal open;
    private BigDecimal price;
    private BigDecimal high;
    private BigDecimal low;
    private BigDecimal volume = BigDecimal.ZERO;
    private List<PriceLevel> bids = List.of();
    private List<PriceLevel> asks = List.of();
    private final Deque<Trade> trades = new ArrayDeque<>();

    private SymbolState(BigDecimal price) {
      this.open = price;
      this.price = price;
      this.high = price;
      this.low = price;
    }
  }
}
