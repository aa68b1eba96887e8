package com.venuelink.adapter.core.event;

import com.venuelink.domain.market.Order;
import java.time.Instant;
import java.util.Objects;

public record OrderUpdate(String venue, Order order, Instant occurredAt) implements AdapterEvent {
  public OrderUpdate {
    Objects.requireNonNull(order, "order must not be null");
  }

  @Override
  public EventKind kind() {
    return EventKind.ORDER_UPDATE;
  }
}
