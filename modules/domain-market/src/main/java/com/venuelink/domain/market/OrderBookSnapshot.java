package com.venuelink.domain.market;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public record OrderBookSnapshot(
    String symbol, Instant timestamp, List<PriceLevel> bids, List<PriceLevel> asks)
    implements MarketPayload {
  public OrderBookSnapshot {
    symbol = CanonicalSymbol.parse(symbol).toString();
    Objects.requireNonNull(timestamp, "timestamp must not be null");
    bids = List.copyOf(Objects.requireNonNull(bids, "bids must not be null"));
    asks = List.copyOf(Objects.requireNonNull(asks, "asks must not be null"));
    requireStrictlyOrdered(bids, true, "bids");
    requireStrictlyOrdered(asks, false, "asks");
  }

  public Optional<PriceLevel> bestBid() {
    return bids.isEmpty() ? Optional.empty() : Optional.of(bids.get(0));
  }

  public Optional<PriceLevel> bestAsk() {
    return asks.isEmpty() ? Optional.empty() : Optional.of(asks.get(0));
  }

  public OrderBookSnapshot limit(int depth) {
    if (depth <= 0 || (bids.size() <= depth && asks.size() <= depth)) {
      return this;
    }
    return new OrderBookSnapshot(
        symbol,
        timestamp,
        bids.subList(0, Math.min(depth, bids.size())),
        asks.subList(0, Math.min(depth, asks.size())));
  }

  private static void requireStrictlyOrdered(
      List<PriceLevel> levels, boolean descending, String side) {
    for (int i = 1; i < levels.size(); i++) {
      int comparison = levels.get(i - 1).price().compareTo(levels.get(i).price());
      if (descending ? comparison <= 0 : comparison >= 0) {
        throw new MarketDomainException(
            side + " must be strictly " + (descending ? "descending" : "ascending") + " by price");
      }
    }
  }
}
