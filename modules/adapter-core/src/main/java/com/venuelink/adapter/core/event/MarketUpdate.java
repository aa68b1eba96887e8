package com.venuelink.adapter.core.event;

import com.venuelink.domain.market.MarketPayload;
import java.time.Instant;
import java.util.Objects;

public record MarketUpdate(
    String venue, String channel, String symbol, MarketPayload data, Instant occurredAt)
    implements AdapterEvent {
  public MarketUpdate {
    Objects.requireNonNull(data, "data must not be null");
    symbol = symbol == null ? data.symbol() : symbol;
  }

  @Override
  public EventKind kind() {
    return EventKind.MARKET_UPDATE;
  }
}
