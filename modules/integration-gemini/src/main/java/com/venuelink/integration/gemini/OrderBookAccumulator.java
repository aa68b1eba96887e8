package com.venuelink.integration.gemini;

import com.venuelink.domain.market.OrderBookSnapshot;
import com.venuelink.domain.market.OrderSide;
import com.venuelink.domain.market.PriceLevel;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Full depth book for one symbol, folded from {@code l2_updates} changes. Not thread safe; the
 * stream protocol holds its book map lock around every use.
 */
final class OrderBookAccumulator {
  private final String symbol;
  private final TreeMap<BigDecimal, BigDecimal> bids = new TreeMap<>(Comparator.reverseOrder());
  private final TreeMap<BigDecimal, BigDecimal> asks = new TreeMap<>();

  OrderBookAccumulator(String symbol) {
    this.symbol = symbol;
  }

  /** A zero size removes the level. */
  void apply(OrderSide side, BigDecimal price, BigDecimal size) {
    TreeMap<BigDecimal, BigDecimal> book = side == OrderSide.BUY ? bids : asks;
    if (size.signum() == 0) {
      book.remove(price);
    } else {
      book.put(price, size);
    }
  }

  OrderBookSnapshot snapshot(Instant timestamp, int depth) {
    return new OrderBookSnapshot(symbol, timestamp, levels(bids, depth), levels(asks, depth));
  }

  private static List<PriceLevel> levels(TreeMap<BigDecimal, BigDecimal> book, int depth) {
    List<PriceLevel> levels = new ArrayList<>(Math.min(book.size(), depth));
    for (Map.Entry<BigDecimal, BigDecimal> level : book.entrySet()) {
      if (levels.size() == depth) {
        break;
      }
      levels.add(PriceLevel.of(level.getKey(), level.getValue()));
    }
    return levels;
  }
}
